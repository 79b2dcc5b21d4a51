package com.hrintake.telegram.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Uniform outcome of a Bot API call. Transport problems never escape as exceptions; they end up
 * here with a {@link FailureKind}.
 */
public record ApiResult(
    boolean ok, JsonNode result, String description, Integer errorCode, FailureKind failure) {

  public static ApiResult success(JsonNode result) {
    return new ApiResult(true, result, null, null, FailureKind.NONE);
  }

  public static ApiResult remote(String description, Integer errorCode) {
    return new ApiResult(false, null, description, errorCode, FailureKind.REMOTE);
  }

  public static ApiResult failure(FailureKind kind, String description) {
    return new ApiResult(false, null, description, null, kind);
  }

  public boolean isTransient() {
    return failure == FailureKind.TIMEOUT || failure == FailureKind.CONNECTION;
  }

  public boolean hasErrorCode(int code) {
    return errorCode != null && errorCode == code;
  }

  /** {@code result.message_id} of a sent message, if any. */
  public String messageId() {
    if (!ok || result == null) return null;
    return result.path("message_id").asText(null);
  }
}
