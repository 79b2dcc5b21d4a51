package com.hrintake.telegram.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bot.transport")
public record TransportProperties(
    @NotNull Duration defaultTimeout,
    @NotNull Duration sendTimeout,
    @NotNull Duration longPollMargin,
    @Min(0) int maxRetries,
    @NotNull Duration retryBackoff) {}
