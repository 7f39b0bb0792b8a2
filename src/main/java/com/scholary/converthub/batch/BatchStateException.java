package com.scholary.converthub.batch;

/**
 * Batch bookkeeping reached a state that should be impossible, such as a file settled twice or a
 * batch processed twice. Treated as a programming error: it fails the whole batch call.
 */
public class BatchStateException extends RuntimeException {

  public BatchStateException(String message) {
    super(message);
  }
}
