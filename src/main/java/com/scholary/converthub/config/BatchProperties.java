package com.scholary.converthub.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch processing.
 *
 * <p>{@code concurrency} caps simultaneous conversions inside one batch. {@code globalConcurrency}
 * sizes the worker pool shared by every batch, so the host never runs more than that many
 * conversions at once no matter how many batches are active.
 */
@ConfigurationProperties(prefix = "batch")
@Validated
public record BatchProperties(
    @Positive int maxFiles,
    @Positive long maxTotalBytes,
    @Positive int concurrency,
    @Positive int globalConcurrency,
    @NotNull Duration fileTimeout,
    @NotNull Duration retention,
    @NotNull Duration cleanupInterval) {}
