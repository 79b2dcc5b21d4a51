package com.hrintake.telegram.store.mongo;

import com.hrintake.telegram.i18n.Language;
import com.hrintake.telegram.session.ConversationMode;
import com.hrintake.telegram.session.Session;
import com.hrintake.telegram.session.SessionMirror;
import com.hrintake.telegram.session.Step;
import com.hrintake.telegram.store.DocumentStoreStatus;
import java.util.HashMap;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class MongoSessionMirror implements SessionMirror {

  private final UserStateMongoRepository states;
  private final UserLangMongoRepository languages;
  private final DocumentStoreStatus status;

  @Override
  public boolean isAvailable() {
    return status.isAvailable();
  }

  @Override
  public Optional<Session> loadState(String userId) {
    return states.findById(userId).flatMap(this::toSession);
  }

  @Override
  public void saveState(Session session) {
    UserStateDocument doc = new UserStateDocument();
    doc.setUserId(session.userId());
    doc.setMode(session.mode().code());
    doc.setStep(session.step().code());
    doc.setData(new HashMap<>(session.formData()));
    states.save(doc);
  }

  @Override
  public void deleteState(String userId) {
    states.deleteById(userId);
  }

  @Override
  public Optional<Language> loadLanguage(String userId) {
    return languages.findById(userId).flatMap(doc -> Language.fromCode(doc.getLang()));
  }

  @Override
  public void saveLanguage(String userId, Language language) {
    UserLangDocument doc = new UserLangDocument();
    doc.setUserId(userId);
    doc.setLang(language.code());
    languages.save(doc);
  }

  private Optional<Session> toSession(UserStateDocument doc) {
    Optional<ConversationMode> mode = ConversationMode.fromCode(doc.getMode());
    Optional<Step> step = Step.fromCode(doc.getStep());
    if (mode.isEmpty() || step.isEmpty()) {
      log.warn(
          "Ignoring stored state of user {} with mode={} step={}",
          doc.getUserId(),
          doc.getMode(),
          doc.getStep());
      return Optional.empty();
    }
    return Optional.of(new Session(doc.getUserId(), mode.get(), step.get(), doc.getData()));
  }
}
