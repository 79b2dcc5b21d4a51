package com.hrintake.telegram.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Document store switches. With {@code enabled=false} the bot runs memory-only. */
@Validated
@ConfigurationProperties(prefix = "bot.store")
public record StoreProperties(
    boolean enabled, @Min(1) int saveAttempts, @NotNull Duration saveBackoff) {}
