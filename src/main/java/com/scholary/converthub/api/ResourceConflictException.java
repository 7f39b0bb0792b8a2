package com.scholary.converthub.api;

/** The resource exists but is not in a state that allows the request. */
public class ResourceConflictException extends RuntimeException {

  public ResourceConflictException(String message) {
    super(message);
  }
}
