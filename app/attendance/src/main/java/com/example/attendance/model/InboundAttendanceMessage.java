/*
 * どこで: Attendance ドメインモデル
 * 何を: エンジンへ渡される 1 投稿分の入力を表す
 * なぜ: NATS 経由と HTTP 経由の取り込みを同じ入口にそろえるため
 */
package com.example.attendance.model;

import java.time.Instant;

public record InboundAttendanceMessage(
    String tenantId,
    String authorExternalId,
    String channelId,
    String messageId,
    String text,
    Instant authoredAt) {}
