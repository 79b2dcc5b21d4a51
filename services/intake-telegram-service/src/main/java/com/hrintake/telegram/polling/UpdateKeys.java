package com.hrintake.telegram.polling;

import com.fasterxml.jackson.databind.JsonNode;

final class UpdateKeys {

  private UpdateKeys() {}

  /** Key that serializes processing: the sender's user id, else the update id. */
  static String userKey(JsonNode update) {
    for (String field : new String[] {"message", "callback_query"}) {
      JsonNode from = update.path(field).path("from").path("id");
      if (!from.isMissingNode() && !from.isNull()) {
        return "user:" + from.asText();
      }
    }
    return "update:" + update.path("update_id").asText("?");
  }
}
