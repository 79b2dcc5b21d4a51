package com.hrintake.telegram.session;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Where a user is in a conversation. Immutable; every transition produces a new instance.
 *
 * <p>Form fields accumulated so far live in {@code formData} under the keys {@code name}, {@code
 * phone}, {@code category}, {@code position} and {@code exp}.
 */
public record Session(String userId, ConversationMode mode, Step step, Map<String, String> formData) {

  public static final String NAME = "name";
  public static final String PHONE = "phone";
  public static final String CATEGORY = "category";
  public static final String POSITION = "position";
  public static final String EXPERIENCE = "exp";

  public Session {
    formData = formData == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(formData));
  }

  public static Session startJob(String userId) {
    return new Session(userId, ConversationMode.JOB, Step.NAME, Map.of());
  }

  public static Session admin(String userId, Step step) {
    return new Session(userId, ConversationMode.ADMIN, step, Map.of());
  }

  public boolean isAdmin() {
    return mode == ConversationMode.ADMIN;
  }

  public Session withStep(Step next) {
    return new Session(userId, mode, next, formData);
  }

  /** Stores {@code value} under {@code key} and moves on to {@code next}. */
  public Session advance(String key, String value, Step next) {
    Map<String, String> data = new HashMap<>(formData);
    data.put(key, value);
    return new Session(userId, mode, next, data);
  }

  public String field(String key) {
    return formData.get(key);
  }
}
