package com.scholary.converthub.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Inside a batch, a storage failure becomes the affected file's error result; over HTTP it maps
 * to 502.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
