package com.hrintake.telegram.conversation;

/** Input rules of the job application form. */
public final class IntakeValidators {

  static final int MIN_NAME_LENGTH = 5;
  static final int MIN_PHONE_DIGITS = 9;
  static final int MAX_PHONE_DIGITS = 15;

  private IntakeValidators() {}

  /** At least two words and five characters: "Ali Valiyev". */
  public static boolean isValidName(String text) {
    if (text == null) return false;
    String t = text.trim();
    return t.split("\\s+").length >= 2 && t.length() >= MIN_NAME_LENGTH;
  }

  /** 9 to 15 digits, ignoring everything else ("+998 90 123-45-67" is fine). */
  public static boolean isValidPhone(String text) {
    if (text == null) return false;
    long digits = text.chars().filter(Character::isDigit).count();
    return digits >= MIN_PHONE_DIGITS && digits <= MAX_PHONE_DIGITS;
  }

  public static boolean isValidPositionDetail(String text) {
    return text != null && text.trim().length() > 2;
  }

  public static boolean isValidExperience(String text) {
    return text != null && text.trim().length() > 5;
  }

  /**
   * Final position from the category name (icon already stripped) and the typed detail.
   * "Management" + "accountant" gives "Management (accountant)"; the "other position" category
   * keeps only the detail.
   */
  public static String composePosition(String categoryName, String detail, boolean otherPosition) {
    String d = detail.trim();
    if (otherPosition || categoryName == null || categoryName.isBlank()) {
      return d;
    }
    return categoryName.trim() + " (" + d + ")";
  }
}
