package com.scholary.converthub.converter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Map;

/**
 * Result of converting one file.
 *
 * <p>Exactly one of {@code resultUrl} and {@code errorMessage} is set, matching {@code status}.
 * Use the {@link #success} and {@link #error} factories.
 */
public record ConversionResult(
    ConversionStatus status,
    String resultUrl,
    String taskId,
    Map<String, Object> metadata,
    String errorMessage,
    Long processingTimeMs) {

  public static final String INPUT_FILENAME = "input_filename";
  public static final String OUTPUT_FORMAT = "output_format";

  public ConversionResult {
    if (status == null) {
      throw new IllegalArgumentException("status is required");
    }
    if (status == ConversionStatus.SUCCESS && (resultUrl == null || errorMessage != null)) {
      throw new IllegalArgumentException("A successful result needs a URL and no error");
    }
    if (status == ConversionStatus.ERROR && (errorMessage == null || resultUrl != null)) {
      throw new IllegalArgumentException("A failed result needs an error and no URL");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static ConversionResult success(
      String taskId, String resultUrl, Map<String, Object> metadata, long processingTimeMs) {
    return new ConversionResult(
        ConversionStatus.SUCCESS, resultUrl, taskId, metadata, null, processingTimeMs);
  }

  public static ConversionResult error(
      String taskId, String errorMessage, Map<String, Object> metadata, long processingTimeMs) {
    return new ConversionResult(
        ConversionStatus.ERROR, null, taskId, metadata, errorMessage, processingTimeMs);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return status == ConversionStatus.SUCCESS;
  }

  @JsonIgnore
  public String inputFilename() {
    Object value = metadata.get(INPUT_FILENAME);
    return value == null ? null : value.toString();
  }
}
