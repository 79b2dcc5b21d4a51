package com.hrintake.telegram.i18n;

import java.util.Optional;

/** Every reply-keyboard button the bot understands, tagged with the text key of its label. */
public enum MenuAction {
  ABOUT("menu-about"),
  CONTACT("menu-contact"),
  LOCATION("menu-location"),
  JOBS("menu-jobs"),
  CHANGE_LANGUAGE("menu-lang"),
  BACK("back"),
  CANCEL("cancel"),
  SKIP("skip"),
  LANG_UZ("lang-uz", Language.UZ),
  LANG_UZ_CYRL("lang-uz-cyrl", Language.UZ_CYRL),
  LANG_EN("lang-en", Language.EN),
  LANG_RU("lang-ru", Language.RU),
  ADMIN("menu-admin"),
  ADMIN_APPS("admin-apps"),
  ADMIN_SEARCH("admin-search"),
  ADMIN_STATS("admin-stats"),
  OTHER_POSITION("other-position");

  private final String textKey;
  private final Language targetLanguage;

  MenuAction(String textKey) {
    this(textKey, null);
  }

  MenuAction(String textKey, Language targetLanguage) {
    this.textKey = textKey;
    this.targetLanguage = targetLanguage;
  }

  public String textKey() {
    return textKey;
  }

  /** The language a language button switches to. */
  public Optional<Language> targetLanguage() {
    return Optional.ofNullable(targetLanguage);
  }

  public boolean isAdminSubMenu() {
    return this == ADMIN_APPS || this == ADMIN_SEARCH || this == ADMIN_STATS;
  }
}
