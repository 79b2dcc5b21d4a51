package com.hrintake.telegram.session;

import com.hrintake.telegram.i18n.Language;
import java.util.Optional;

/** Per-user conversation state and language preference. */
public interface SessionStore {

  Optional<Session> getState(String userId);

  /** {@code null} clears the state. */
  void setState(String userId, Session session);

  default void clearState(String userId) {
    setState(userId, null);
  }

  Language getLanguage(String userId);

  void setLanguage(String userId, Language language);
}
