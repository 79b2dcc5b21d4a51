package com.hrintake.telegram.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bot.polling")
public record PollingProperties(
    boolean enabled,
    @Min(1) int timeoutSeconds,
    @Min(1) int workers,
    @NotNull Duration backoffStep,
    @NotNull Duration maxBackoff,
    @NotNull Duration errorPause,
    @NotNull Duration shutdownGrace) {}
