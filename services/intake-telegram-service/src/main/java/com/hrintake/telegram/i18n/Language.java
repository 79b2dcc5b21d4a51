package com.hrintake.telegram.i18n;

import java.util.Arrays;
import java.util.Optional;

public enum Language {
  UZ("uz"),
  UZ_CYRL("uz_cyrl"),
  EN("en"),
  RU("ru");

  private final String code;

  Language(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Key under {@code texts.locales}; property map keys cannot carry underscores. */
  public String propertyKey() {
    return code.replace('_', '-');
  }

  public static Optional<Language> fromCode(String code) {
    if (code == null) return Optional.empty();
    String c = code.trim();
    return Arrays.stream(values()).filter(l -> l.code.equalsIgnoreCase(c)).findFirst();
  }
}
