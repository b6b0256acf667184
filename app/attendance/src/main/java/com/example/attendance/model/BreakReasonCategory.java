/*
 * どこで: Attendance ドメインモデル
 * 何を: 休憩理由のカテゴリを定義する
 * なぜ: 理由の集計をカテゴリ単位で行うため
 */
package com.example.attendance.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum BreakReasonCategory {
  MEAL("meal"),
  PERSONAL("personal"),
  REST("rest"),
  MEETING("meeting"),
  EMERGENCY("emergency"),
  OTHER("other");

  private final String value;

  BreakReasonCategory(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static Optional<BreakReasonCategory> findByValue(String category) {
    if (category == null) {
      return Optional.empty();
    }
    for (BreakReasonCategory reasonCategory : values()) {
      if (reasonCategory.value.equalsIgnoreCase(category.trim())) {
        return Optional.of(reasonCategory);
      }
    }
    return Optional.empty();
  }

  public static BreakReasonCategory fromValue(String category) {
    return findByValue(category)
        .orElseThrow(() -> new IllegalArgumentException("unsupported reason category: " + category));
  }
}
