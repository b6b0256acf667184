/*
 * どこで: Attendance ドメインモデル
 * 何を: 1 投稿の記録結果 (監査イベントと更新後ステータス) を表す
 * なぜ: 記録トランザクションの結果を通知処理へ渡すため
 */
package com.example.attendance.model;

public record RecordedAttendance(
    AttendanceEventRecord event, UserAttendanceStatusRecord status) {

  // userId 未解決の場合はステータス投影をスキップするため status は null になる
  public boolean hasStatus() {
    return status != null;
  }
}
