package com.hrintake.telegram.model;

import java.util.Map;

public enum KeyboardRemove implements ReplyMarkup {
  INSTANCE;

  @Override
  public Map<String, Object> toPayload() {
    return Map.of("remove_keyboard", true);
  }
}
