package com.hrintake.telegram.i18n;

import com.hrintake.telegram.config.BotProperties;
import java.util.HashMap;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Localized texts from {@code bot-texts.yml}.
 *
 * <p>Lookup order: the requested language, then the default language, then the key itself.
 */
@Component
@Slf4j
@ConfigurationProperties(prefix = "texts")
public class BotTexts {

  private Map<String, Map<String, String>> locales = new HashMap<>();
  private Map<String, List<List<String>>> positions = new HashMap<>();
  private Language defaultLanguage = Language.UZ;

  @Autowired
  void setBotProperties(BotProperties bot) {
    if (bot.defaultLanguage() != null) {
      this.defaultLanguage = bot.defaultLanguage();
    }
  }

  public Language defaultLanguage() {
    return defaultLanguage;
  }

  public String text(String key, Language lang) {
    String localized = lookup(key, lang);
    if (localized == null) {
      localized = lookup(key, defaultLanguage);
    }
    return localized == null ? key : localized;
  }

  public String format(String key, Language lang, Object... args) {
    String template = text(key, lang);
    try {
      return String.format(template, args == null ? new Object[0] : args);
    } catch (IllegalFormatException e) {
      log.warn("Bad text template '{}' for {}: {}", key, lang, e.getMessage());
      return template;
    }
  }

  /** Position category rows as shown on the keyboard. */
  public List<List<String>> positions(Language lang) {
    List<List<String>> rows = lang == null ? null : positions.get(lang.propertyKey());
    if (rows == null || rows.isEmpty()) {
      rows = positions.getOrDefault(defaultLanguage.propertyKey(), List.of());
    }
    return rows;
  }

  private String lookup(String key, Language lang) {
    if (key == null || lang == null) {
      return null;
    }
    Map<String, String> table = locales.get(lang.propertyKey());
    if (table == null) {
      return null;
    }
    String value = table.get(key);
    return value == null || value.isBlank() ? null : value;
  }

  public Map<String, Map<String, String>> getLocales() {
    return locales;
  }

  public void setLocales(Map<String, Map<String, String>> locales) {
    this.locales = locales == null ? new HashMap<>() : locales;
  }

  public Map<String, List<List<String>>> getPositions() {
    return positions;
  }

  public void setPositions(Map<String, List<List<String>>> positions) {
    this.positions = positions == null ? new HashMap<>() : positions;
  }
}
