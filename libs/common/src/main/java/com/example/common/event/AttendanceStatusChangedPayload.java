/*
 * どこで: common のイベント payload 定義
 * 何を: 勤怠ステータス変更のリアルタイム通知 payload を共通レコードとして提供する
 * なぜ: 購読側 (ダッシュボード等) と同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceStatusChangedPayload(
    String eventId,
    String tenantId,
    String userId,
    String externalId,
    String displayName,
    String status,
    String eventType,
    String reason,
    String expectedReturnAt,
    String lastCheckinAt,
    String lastCheckoutAt,
    String occurredAt,
    String traceId) {}
