package com.hrintake.telegram.session;

import java.util.Arrays;
import java.util.Optional;

public enum Step {
  // job application form, in order
  NAME("name"),
  PHONE("phone"),
  POSITION("position"),
  POSITION_MANUAL("position_manual"),
  EXP("exp"),
  CV("cv"),
  // admin console
  MENU("menu"),
  SEARCH_POSITION("search_position");

  private final String code;

  Step(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Optional<Step> fromCode(String code) {
    if (code == null) return Optional.empty();
    return Arrays.stream(values()).filter(s -> s.code.equals(code)).findFirst();
  }
}
