/*
 * どこで: Attendance API リクエスト DTO
 * 何を: 投稿取り込み API の入力を定義する
 * なぜ: NATS を使わない連携元からも同じ取り込み処理を呼べるようにするため
 */
package com.example.attendance.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestAttendanceMessageRequest(
    @NotBlank String authorId,
    @NotBlank String channelId,
    @NotBlank String messageId,
    @NotNull String content,
    @NotNull Instant authoredAt) {}
