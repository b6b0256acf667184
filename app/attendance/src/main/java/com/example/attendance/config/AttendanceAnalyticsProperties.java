/*
 * どこで: Attendance 設定
 * 何を: パターン分析で時刻を丸めるタイムゾーンを保持する
 * なぜ: チームの所在地に合わせて時間帯ヒストグラムを作るため
 */
package com.example.attendance.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "attendance.analytics")
public record AttendanceAnalyticsProperties(ZoneId zoneId) {

  public AttendanceAnalyticsProperties {
    zoneId = zoneId == null ? ZoneId.of("UTC") : zoneId;
  }
}
