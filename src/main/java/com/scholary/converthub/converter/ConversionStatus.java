package com.scholary.converthub.converter;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Outcome of one file's conversion. */
public enum ConversionStatus {
  SUCCESS,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
