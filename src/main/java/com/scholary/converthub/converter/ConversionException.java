package com.scholary.converthub.converter;

/**
 * Exception thrown when a single file cannot be converted.
 *
 * <p>Inside a batch this never propagates past the unit of work that raised it: it becomes that
 * file's error result and the rest of the batch carries on.
 */
public class ConversionException extends RuntimeException {

  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
