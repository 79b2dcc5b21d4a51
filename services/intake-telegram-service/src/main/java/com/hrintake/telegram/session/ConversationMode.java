package com.hrintake.telegram.session;

import java.util.Arrays;
import java.util.Optional;

public enum ConversationMode {
  JOB("job"),
  ADMIN("admin");

  private final String code;

  ConversationMode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Optional<ConversationMode> fromCode(String code) {
    if (code == null) return Optional.empty();
    return Arrays.stream(values()).filter(m -> m.code.equals(code)).findFirst();
  }
}
