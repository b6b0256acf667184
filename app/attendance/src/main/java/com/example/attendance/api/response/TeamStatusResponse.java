/*
 * どこで: Attendance API レスポンス DTO
 * 何を: テナント全メンバーの現在状態と状態別人数を表す
 * なぜ: 在席/休憩/退勤の一覧と集計を同じ応答で返すため
 */
package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TeamStatusResponse(List<UserStatusResponse> teamStatus, Map<String, Long> summary) {}
