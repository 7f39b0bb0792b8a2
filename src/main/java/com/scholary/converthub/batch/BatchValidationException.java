package com.scholary.converthub.batch;

/** A batch submission was rejected before any processing started. */
public class BatchValidationException extends RuntimeException {

  public BatchValidationException(String message) {
    super(message);
  }
}
