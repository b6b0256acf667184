/*
 * どこで: Attendance ドメインモデル
 * 何を: 1 投稿の分類結果を表す
 * なぜ: ルール分類と AI 分類の結果を同じ形で後段に渡すため
 */
package com.example.attendance.model;

public record ClassifiedEvent(
    AttendanceEventKind kind,
    double confidence,
    String reason,
    BreakReasonCategory reasonCategory,
    Integer expectedDurationMinutes,
    Urgency urgency,
    ClassifierSource source) {

  public static final int MAX_EXPECTED_DURATION_MINUTES = 480;

  public static ClassifiedEvent none(ClassifierSource source) {
    return new ClassifiedEvent(AttendanceEventKind.NONE, 1.0, null, null, null, Urgency.NORMAL, source);
  }

  public static ClassifiedEvent of(AttendanceEventKind kind, double confidence, ClassifierSource source) {
    return new ClassifiedEvent(kind, confidence, null, null, null, Urgency.NORMAL, source);
  }

  public boolean isNone() {
    return kind == AttendanceEventKind.NONE;
  }
}
