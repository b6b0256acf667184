package com.example.attendance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassifierSource {
  RULE("rule"),
  AI("ai");

  private final String value;

  ClassifierSource(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static ClassifierSource fromValue(String source) {
    for (ClassifierSource classifierSource : values()) {
      if (classifierSource.value.equalsIgnoreCase(source)) {
        return classifierSource;
      }
    }
    throw new IllegalArgumentException("unsupported classifier source: " + source);
  }
}
