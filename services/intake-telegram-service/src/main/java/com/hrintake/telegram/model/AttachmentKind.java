package com.hrintake.telegram.model;

import java.util.Arrays;
import java.util.Optional;

public enum AttachmentKind {
  DOCUMENT("doc", "sendDocument", "document"),
  PHOTO("photo", "sendPhoto", "photo");

  private final String code;
  private final String sendMethod;
  private final String paramName;

  AttachmentKind(String code, String sendMethod, String paramName) {
    this.code = code;
    this.sendMethod = sendMethod;
    this.paramName = paramName;
  }

  /** Value persisted with the application. */
  public String code() {
    return code;
  }

  public String sendMethod() {
    return sendMethod;
  }

  public String paramName() {
    return paramName;
  }

  public static Optional<AttachmentKind> fromCode(String code) {
    if (code == null) return Optional.empty();
    return Arrays.stream(values()).filter(k -> k.code.equals(code)).findFirst();
  }
}
