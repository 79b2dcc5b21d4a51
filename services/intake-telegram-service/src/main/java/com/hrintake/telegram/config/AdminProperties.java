package com.hrintake.telegram.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bot.admin")
public record AdminProperties(
    @Min(1) int pageSize,
    @Min(1) int searchLimit,
    @Min(1) int searchScanLimit,
    @Min(1) int statsDays,
    @Min(1) int statsLimit,
    @Min(100) int chunkSize) {}
