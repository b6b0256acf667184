/*
 * どこで: Attendance API レスポンス DTO
 * 何を: 出勤/退勤など 1 種別の時間帯パターン (ピーク時間・平均時刻・時間帯分布) を表す
 * なぜ: 種別ごとの集計を同じ形で返すため
 */
package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HourPattern(
    List<PeakHour> peakHours, String averageTime, Map<String, Long> hourDistribution) {}
