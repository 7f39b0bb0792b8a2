package com.scholary.converthub.batch;

/** Thrown when a batch id is unknown, or was already purged by the retention sweep. */
public class BatchNotFoundException extends RuntimeException {

  public BatchNotFoundException(String batchId) {
    super("Batch not found: " + batchId);
  }
}
