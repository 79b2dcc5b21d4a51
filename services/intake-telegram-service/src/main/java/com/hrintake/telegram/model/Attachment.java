package com.hrintake.telegram.model;

/** Opaque platform file reference plus the way it has to be re-sent. */
public record Attachment(String fileId, AttachmentKind kind) {

  public static Attachment of(String fileId, String kindCode) {
    if (fileId == null || fileId.isBlank()) {
      return null;
    }
    return AttachmentKind.fromCode(kindCode).map(k -> new Attachment(fileId, k)).orElse(null);
  }
}
