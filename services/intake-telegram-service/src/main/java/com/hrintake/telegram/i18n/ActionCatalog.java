package com.hrintake.telegram.i18n;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Two-way mapping between button labels and {@link MenuAction}s, built once from {@link BotTexts}.
 *
 * <p>A label is resolved against the user's language first and then against the default
 * language, so a keyboard rendered before a language switch keeps working.
 */
@Component
@Slf4j
public class ActionCatalog {

  private final BotTexts texts;
  private final Map<Language, Map<String, MenuAction>> byLabel = new EnumMap<>(Language.class);
  private final Set<String> otherPositionLabels = new HashSet<>();
  private final Set<String> categoryIcons = new HashSet<>();

  public ActionCatalog(BotTexts texts) {
    this.texts = texts;
    for (Language lang : Language.values()) {
      Map<String, MenuAction> labels = new HashMap<>();
      for (MenuAction action : MenuAction.values()) {
        String label = texts.text(action.textKey(), lang).trim();
        MenuAction previous = labels.putIfAbsent(label, action);
        if (previous != null && previous != action) {
          log.warn(
              "Label '{}' in {} is shared by {} and {}; {} wins", label, lang, previous, action, previous);
        }
      }
      byLabel.put(lang, Collections.unmodifiableMap(labels));
      otherPositionLabels.add(texts.text(MenuAction.OTHER_POSITION.textKey(), lang).trim());
      for (List<String> row : texts.positions(lang)) {
        for (String category : row) {
          leadingToken(category).ifPresent(categoryIcons::add);
        }
      }
    }
  }

  public Optional<MenuAction> resolve(String text, Language lang) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String t = text.trim();
    MenuAction action = byLabel.get(lang == null ? texts.defaultLanguage() : lang).get(t);
    if (action == null) {
      action = byLabel.get(texts.defaultLanguage()).get(t);
    }
    return Optional.ofNullable(action);
  }

  public String label(MenuAction action, Language lang) {
    return texts.text(action.textKey(), lang);
  }

  /** True for the "other position" label of any supported language. */
  public boolean isOtherPosition(String category) {
    return category != null && otherPositionLabels.contains(category.trim());
  }

  /** Drops the leading category icon ("🏢 Management" becomes "Management"). */
  public String stripCategoryIcon(String position) {
    if (position == null) {
      return null;
    }
    String p = position.trim();
    int space = p.indexOf(' ');
    if (space > 0 && categoryIcons.contains(p.substring(0, space))) {
      return p.substring(space + 1).trim();
    }
    return p;
  }

  private static Optional<String> leadingToken(String category) {
    if (category == null) return Optional.empty();
    String c = category.trim();
    int space = c.indexOf(' ');
    return space > 0 ? Optional.of(c.substring(0, space)) : Optional.empty();
  }
}
