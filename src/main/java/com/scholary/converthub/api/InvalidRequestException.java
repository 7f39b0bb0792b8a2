package com.scholary.converthub.api;

/** A request parameter is outside its accepted range. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
