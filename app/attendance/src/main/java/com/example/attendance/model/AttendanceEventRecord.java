/*
 * どこで: Attendance ドメインモデル
 * 何を: attendance_events (追記専用の監査ログ) の 1 行を表す
 * なぜ: ステータス再構築と分析の唯一の根拠として扱うため
 */
package com.example.attendance.model;

import java.time.Instant;
import java.util.UUID;

public record AttendanceEventRecord(
    UUID eventId,
    String tenantId,
    String userId,
    AttendanceEventKind kind,
    double confidence,
    String reason,
    BreakReasonCategory reasonCategory,
    Urgency urgency,
    ClassifierSource source,
    Instant eventTime,
    Instant expectedReturnTime,
    Integer actualDurationMinutes,
    String channelId,
    String messageId,
    String rawMessage,
    Instant createdAt) {

  public boolean hasUser() {
    return userId != null;
  }
}
