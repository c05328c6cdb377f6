package com.acme.pipeline.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Operation requested by a job. Lets new job types share the classification queue. */
public enum JobAction {
  CLASSIFY("classify");

  private final String wireName;

  JobAction(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static JobAction fromWire(String value) {
    if (value == null || value.isBlank()) {
      return CLASSIFY;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (JobAction action : values()) {
      if (action.wireName.equals(normalized)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown job action: " + value);
  }
}
