package com.scholary.converthub.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for single-file conversions and the converters themselves.
 *
 * <p>Controls the async executor, the result cache and the ffmpeg binary used for media.
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public record ConversionProperties(
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @NotNull Duration cacheTtl,
    @Positive int cacheMaxSize,
    @NotBlank String ffmpegPath,
    @NotNull Duration ffmpegTimeout,
    @NotBlank String tempDir) {}
