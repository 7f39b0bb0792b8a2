package com.scholary.converthub.batch;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a batch, safe to hand to clients while the batch is running. {@code files}
 * lists the submitted files in input order with their content digests.
 */
public record BatchStatusSnapshot(
    String batchId,
    String operation,
    BatchStatus status,
    int totalFiles,
    int completed,
    int failed,
    int progressPercentage,
    boolean cancelRequested,
    Instant createdAt,
    String zipUrl,
    List<FileDescriptor> files) {

  /** {@code floor((completed + failed) / totalFiles * 100)}. */
  static int percentSettled(int completed, int failed, int totalFiles) {
    if (totalFiles <= 0) {
      return 0;
    }
    return (int) ((completed + failed) * 100L / totalFiles);
  }
}
