package com.scholary.converthub.batch;

import com.scholary.converthub.converter.ConversionResult;
import java.util.List;

/**
 * Final outcome of a batch.
 *
 * <p>{@code results.get(i)} belongs to input file {@code i}. {@code zipUrl} is null when no file
 * succeeded or the archive could not be stored.
 */
public record BatchResult(
    String batchId,
    int totalFiles,
    int completed,
    int failed,
    List<ConversionResult> results,
    String zipUrl) {

  public BatchResult {
    results = List.copyOf(results);
  }
}
