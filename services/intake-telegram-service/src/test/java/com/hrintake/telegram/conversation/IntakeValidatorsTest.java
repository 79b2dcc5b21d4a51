package com.hrintake.telegram.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class IntakeValidatorsTest {

  @Test
  void name_needsTwoWordsAndFiveCharacters() {
    assertThat(IntakeValidators.isValidName("Ali")).isFalse();
    assertThat(IntakeValidators.isValidName("Al V")).isFalse();
    assertThat(IntakeValidators.isValidName("Ali V")).isTrue();
    assertThat(IntakeValidators.isValidName("Ali Vo")).isTrue();
    assertThat(IntakeValidators.isValidName("  Ali   Valiyev  ")).isTrue();
    assertThat(IntakeValidators.isValidName("   ")).isFalse();
    assertThat(IntakeValidators.isValidName(null)).isFalse();
  }

  @Test
  void phone_counts_only_digits() {
    assertThat(IntakeValidators.isValidPhone("901234567")).isTrue();
    assertThat(IntakeValidators.isValidPhone("998901234567")).isTrue();
    assertThat(IntakeValidators.isValidPhone("+998 (90) 123-45-67")).isTrue();
    assertThat(IntakeValidators.isValidPhone("12345")).isFalse();
    assertThat(IntakeValidators.isValidPhone("1234567890123456")).isFalse();
    assertThat(IntakeValidators.isValidPhone("call me")).isFalse();
  }

  @Test
  void positionDetail_andExperience_lengthRules() {
    assertThat(IntakeValidators.isValidPositionDetail("IT")).isFalse();
    assertThat(IntakeValidators.isValidPositionDetail(" IT ")).isFalse();
    assertThat(IntakeValidators.isValidPositionDetail("Math")).isTrue();

    assertThat(IntakeValidators.isValidExperience("5 yrs")).isFalse();
    assertThat(IntakeValidators.isValidExperience("5 years")).isTrue();
  }

  @Test
  void composePosition_appendsDetailToCategoryName() {
    assertThat(IntakeValidators.composePosition("Management", " accountant", false))
        .isEqualTo("Management (accountant)");
    assertThat(IntakeValidators.composePosition("Senior Developer", "backend", false))
        .isEqualTo("Senior Developer (backend)");
    assertThat(IntakeValidators.composePosition(null, "math", false)).isEqualTo("math");
  }

  @Test
  void composePosition_otherPositionKeepsOnlyDetail() {
    assertThat(IntakeValidators.composePosition("💡 Other position", " Janitor ", true))
        .isEqualTo("Janitor");
  }
}
