package com.scholary.converthub.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the progress tracker.
 *
 * <p>Terminal tasks are kept for {@code retention} after their last update. The sweep runs every
 * {@code sweepInterval}; a failed sweep is retried after {@code sweepRetryBackoff}. {@code
 * listLimit} is the default page size of the task listing.
 */
@ConfigurationProperties(prefix = "progress")
@Validated
public record ProgressProperties(
    @NotNull Duration retention,
    @NotNull Duration sweepInterval,
    @NotNull Duration sweepRetryBackoff,
    @Positive int listLimit) {}
