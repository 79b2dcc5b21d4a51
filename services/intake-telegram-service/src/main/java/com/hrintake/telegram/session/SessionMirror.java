package com.hrintake.telegram.session;

import com.hrintake.telegram.i18n.Language;
import java.util.Optional;

/**
 * Durable copy of sessions and language preferences, used to survive restarts.
 *
 * <p>Implementations may throw {@link org.springframework.dao.DataAccessException}.
 */
public interface SessionMirror {

  boolean isAvailable();

  Optional<Session> loadState(String userId);

  void saveState(Session session);

  void deleteState(String userId);

  Optional<Language> loadLanguage(String userId);

  void saveLanguage(String userId, Language language);
}
