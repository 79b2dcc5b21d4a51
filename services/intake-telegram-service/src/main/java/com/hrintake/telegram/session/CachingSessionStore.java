package com.hrintake.telegram.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hrintake.telegram.config.SessionCacheProperties;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.i18n.Language;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** In-memory sessions with a write-through copy in the document store. */
@Service
@Slf4j
public class CachingSessionStore implements SessionStore {

  private final SessionMirror mirror;
  private final Language defaultLanguage;
  private final Cache<String, Optional<Session>> states;
  private final Cache<String, Language> languages;
  // только для доступа к кэшам; зеркало вызывается вне блокировки
  private final ReentrantLock lock = new ReentrantLock();

  public CachingSessionStore(
      SessionMirror mirror, BotTexts texts, SessionCacheProperties properties) {
    this.mirror = mirror;
    this.defaultLanguage = texts.defaultLanguage();
    this.states =
        Caffeine.newBuilder()
            .maximumSize(properties.maximumSize())
            .expireAfterAccess(properties.expireAfterAccess())
            .build();
    this.languages =
        Caffeine.newBuilder()
            .maximumSize(properties.maximumSize())
            .expireAfterAccess(properties.expireAfterAccess())
            .build();
  }

  @Override
  public Optional<Session> getState(String userId) {
    Optional<Session> cached = guarded(() -> states.getIfPresent(userId));
    if (cached != null) {
      return cached;
    }
    if (!mirror.isAvailable()) {
      return Optional.empty();
    }

    Optional<Session> loaded;
    try {
      loaded = mirror.loadState(userId);
    } catch (DataAccessException e) {
      log.error("Failed to load state for user {}: {}", userId, e.getMessage());
      return Optional.empty();
    }
    return guarded(
        () -> {
          Optional<Session> raced = states.getIfPresent(userId);
          if (raced != null) {
            return raced;
          }
          states.put(userId, loaded);
          return loaded;
        });
  }

  @Override
  public void setState(String userId, Session session) {
    Optional<Session> value = Optional.ofNullable(session);
    write(() -> states.put(userId, value));
    if (!mirror.isAvailable()) {
      return;
    }
    try {
      if (session == null) {
        mirror.deleteState(userId);
      } else {
        mirror.saveState(session);
      }
    } catch (DataAccessException e) {
      log.error("Failed to mirror state for user {}: {}", userId, e.getMessage());
    }
  }

  @Override
  public Language getLanguage(String userId) {
    Language cached = guarded(() -> languages.getIfPresent(userId));
    if (cached != null) {
      return cached;
    }
    if (!mirror.isAvailable()) {
      return defaultLanguage;
    }

    Language loaded;
    try {
      loaded = mirror.loadLanguage(userId).orElse(defaultLanguage);
    } catch (DataAccessException e) {
      log.error("Failed to load language for user {}: {}", userId, e.getMessage());
      return defaultLanguage;
    }
    return guarded(
        () -> {
          Language raced = languages.getIfPresent(userId);
          if (raced != null) {
            return raced;
          }
          languages.put(userId, loaded);
          return loaded;
        });
  }

  @Override
  public void setLanguage(String userId, Language language) {
    write(() -> languages.put(userId, language));
    if (!mirror.isAvailable()) {
      return;
    }
    try {
      mirror.saveLanguage(userId, language);
    } catch (DataAccessException e) {
      log.error("Failed to mirror language for user {}: {}", userId, e.getMessage());
    }
  }

  private <T> T guarded(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private void write(Runnable action) {
    lock.lock();
    try {
      action.run();
    } finally {
      lock.unlock();
    }
  }
}
