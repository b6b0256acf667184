/*
 * どこで: Attendance アプリの設定バインド
 * 何を: 日次カウンタリセットのスケジュール設定を保持する
 * なぜ: リセット時刻と有効/無効を運用で調整できるようにするため
 */
package com.example.attendance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "attendance.daily-reset")
public record AttendanceDailyResetProperties(boolean enabled, String cron, String zone) {}
