package com.hrintake.telegram.model;

import java.util.Map;

/** Anything that can go into the {@code reply_markup} field of an outgoing message. */
public interface ReplyMarkup {

  Map<String, Object> toPayload();
}
