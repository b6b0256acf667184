/*
 * どこで: Attendance ドメインモデル
 * 何を: 投稿から分類される勤怠イベントの種別を定義する
 * なぜ: 分類器・状態遷移・監査ログで同一の種別値を使うため
 */
package com.example.attendance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceEventKind {
  CHECK_IN("checkin"),
  CHECK_OUT("checkout"),
  BREAK_START("break_start"),
  BREAK_END("break_end"),
  NONE("none");

  private final String value;

  AttendanceEventKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * 役割: 永続値や外部分類器の文字列を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static AttendanceEventKind fromValue(String kind) {
    for (AttendanceEventKind eventKind : values()) {
      if (eventKind.value.equalsIgnoreCase(kind)) {
        return eventKind;
      }
    }
    throw new IllegalArgumentException("unsupported event kind: " + kind);
  }
}
