/*
 * どこで: common のイベント payload 定義
 * 何を: チャットブリッジから届く勤怠チャンネルの投稿 payload を表す
 * なぜ: 投稿の送信側と勤怠サービスで同一の JSON 形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttendanceMessagePayload(
    String tenantId,
    String authorId,
    String channelId,
    String messageId,
    String content,
    String authoredAt,
    String traceId) {}
