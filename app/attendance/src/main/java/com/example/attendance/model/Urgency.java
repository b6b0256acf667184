package com.example.attendance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {
  NORMAL("normal"),
  URGENT("urgent");

  private final String value;

  Urgency(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  // 未知の値は通常扱いに寄せる
  public static Urgency fromValueOrNormal(String urgency) {
    if (urgency != null && URGENT.value.equalsIgnoreCase(urgency.trim())) {
      return URGENT;
    }
    return NORMAL;
  }
}
