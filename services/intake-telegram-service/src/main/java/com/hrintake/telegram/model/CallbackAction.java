package com.hrintake.telegram.model;

import com.fasterxml.jackson.databind.JsonNode;

/** A press on an inline keyboard button. */
public record CallbackAction(
    String callbackId, String chatId, String userId, String messageId, String data) {

  public static CallbackAction from(JsonNode callback) {
    JsonNode message = callback.path("message");
    return new CallbackAction(
        callback.path("id").asText(null),
        message.path("chat").path("id").asText(null),
        callback.path("from").path("id").asText(null),
        message.path("message_id").asText(null),
        callback.path("data").asText("").trim());
  }
}
