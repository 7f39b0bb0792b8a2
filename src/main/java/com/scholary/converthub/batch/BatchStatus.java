package com.scholary.converthub.batch;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Batch lifecycle. Transitions only move forward; COMPLETED is final. */
public enum BatchStatus {
  QUEUED,
  PROCESSING,
  COMPLETED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
