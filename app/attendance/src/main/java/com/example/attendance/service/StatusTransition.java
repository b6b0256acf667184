/*
 * どこで: Attendance サービス層
 * 何を: 状態遷移 1 回分の次状態と休憩実績時間の補正内容を持つ
 * なぜ: 逐次反映と監査ログ再生で同じ補正を監査イベントへ書き戻すため
 */
package com.example.attendance.service;

import com.example.attendance.model.UserAttendanceStatusRecord;
import java.time.Instant;

/**
 * 状態遷移 1 回分の結果。
 *
 * <p>休憩終了で実績時間が確定した場合のみ reconciledBreakStartAt / reconciledBreakMinutes が入る。
 */
public record StatusTransition(
    UserAttendanceStatusRecord next,
    Instant reconciledBreakStartAt,
    Integer reconciledBreakMinutes) {

  public static StatusTransition of(UserAttendanceStatusRecord next) {
    return new StatusTransition(next, null, null);
  }

  public boolean hasReconciliation() {
    return reconciledBreakStartAt != null && reconciledBreakMinutes != null;
  }
}
