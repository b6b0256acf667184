/*
 * どこで: Attendance ドメインモデル
 * 何を: user_attendance_status (tenant+user ごとの現在状態) のスナップショットを表す
 * なぜ: 状態遷移を純粋関数として扱い、再生結果と比較できるようにするため
 */
package com.example.attendance.model;

import java.time.Instant;

public record UserAttendanceStatusRecord(
    String tenantId,
    String userId,
    UserStatus status,
    Instant lastCheckInAt,
    Instant lastCheckOutAt,
    Instant lastBreakStartAt,
    String currentBreakReason,
    Instant expectedReturnAt,
    Instant todayCheckInAt,
    int todayBreakCount,
    int todayTotalBreakMinutes,
    Instant updatedAt) {

  public static UserAttendanceStatusRecord initial(String tenantId, String userId) {
    return new UserAttendanceStatusRecord(
        tenantId, userId, UserStatus.UNKNOWN, null, null, null, null, null, null, 0, 0, null);
  }

  /** 休憩終了時に実績時間を計算できる休憩開始時刻があるか。状態が ON_BREAK かどうかは問わない。 */
  public boolean hasBreakStart() {
    return lastBreakStartAt != null;
  }

  /** 日次カウンタだけを差し替えた複製を返す。 */
  public UserAttendanceStatusRecord withTodayCounters(
      Instant checkInAt, int breakCount, int totalBreakMinutes) {
    return new UserAttendanceStatusRecord(
        tenantId,
        userId,
        status,
        lastCheckInAt,
        lastCheckOutAt,
        lastBreakStartAt,
        currentBreakReason,
        expectedReturnAt,
        checkInAt,
        breakCount,
        totalBreakMinutes,
        updatedAt);
  }

  public UserAttendanceStatusRecord withUpdatedAt(Instant at) {
    return new UserAttendanceStatusRecord(
        tenantId,
        userId,
        status,
        lastCheckInAt,
        lastCheckOutAt,
        lastBreakStartAt,
        currentBreakReason,
        expectedReturnAt,
        todayCheckInAt,
        todayBreakCount,
        todayTotalBreakMinutes,
        at);
  }
}
