package com.scholary.converthub.converter;

/** Thrown when a request names an operation no registered converter handles. */
public class UnknownOperationException extends RuntimeException {

  public UnknownOperationException(String operation) {
    super("Unsupported operation: " + operation);
  }
}
