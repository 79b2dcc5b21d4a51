package com.hrintake.telegram.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bot.session")
public record SessionCacheProperties(@Min(1) long maximumSize, @NotNull Duration expireAfterAccess) {}
