/*
 * どこで: Attendance API レスポンス DTO
 * 何を: チーム全体の勤怠パターン分析結果を表す
 * なぜ: ダッシュボードが時間帯傾向とメンバー傾向を 1 回の取得で表示できるようにするため
 */
package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TeamPatternSummary(
    int periodDays,
    boolean hasData,
    String message,
    HourPattern checkinPatterns,
    HourPattern checkoutPatterns,
    BreakPattern breakPatterns,
    TeamInsights teamInsights) {

  public static TeamPatternSummary empty(int periodDays) {
    return new TeamPatternSummary(
        periodDays, false, "No attendance data for this period", null, null, null, null);
  }
}
