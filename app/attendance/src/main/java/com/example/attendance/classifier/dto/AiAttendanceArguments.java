/*
 * どこで: Attendance AI 分類の DTO
 * 何を: record_attendance ツール呼び出しの引数を表す
 * なぜ: AI 応答を型付きで検証してから ClassifiedEvent へ変換するため
 */
package com.example.attendance.classifier.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AiAttendanceArguments(
    String eventType,
    Double confidence,
    String reason,
    String reasonCategory,
    Integer expectedDurationMinutes,
    String urgency) {}
