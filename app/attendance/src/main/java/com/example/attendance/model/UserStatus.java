/*
 * どこで: Attendance ドメインモデル
 * 何を: ユーザーの現在の在席状態を定義する
 * なぜ: ステータス表示と永続値を一貫させるため
 */
package com.example.attendance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UserStatus {
  ACTIVE("active"),
  ON_BREAK("on_break"),
  OFFLINE("offline"),
  UNKNOWN("unknown");

  private final String value;

  UserStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static UserStatus fromValue(String status) {
    for (UserStatus userStatus : values()) {
      if (userStatus.value.equalsIgnoreCase(status)) {
        return userStatus;
      }
    }
    throw new IllegalArgumentException("unsupported user status: " + status);
  }
}
