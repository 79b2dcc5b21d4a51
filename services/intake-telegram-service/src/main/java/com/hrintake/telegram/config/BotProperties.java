package com.hrintake.telegram.config;

import com.hrintake.telegram.i18n.Language;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credentials and identity of the bot.
 *
 * <p>{@code reviewerChatId} is the HR chat: it receives every completed application and is the
 * only chat allowed into the admin console.
 */
@Validated
@ConfigurationProperties(prefix = "bot")
public record BotProperties(
    @NotBlank String token,
    @NotBlank String reviewerChatId,
    @NotBlank String apiBaseUrl,
    @NotBlank String timeZone,
    @NotNull Language defaultLanguage) {

  public boolean isReviewer(String chatId) {
    return chatId != null && reviewerChatId.trim().equals(chatId.trim());
  }

  public ZoneId zoneId() {
    return ZoneId.of(timeZone);
  }
}
