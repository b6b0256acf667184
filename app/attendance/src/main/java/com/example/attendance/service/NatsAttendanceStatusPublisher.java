/*
 * どこで: Attendance サービス層 (NATS 出力)
 * 何を: ステータス変更ペイロードをテナント別 subject へ Nats-Msg-Id 付きで publish する
 * なぜ: 購読側が監査イベント ID で重複排除と突き合わせをできるようにするため
 */
package com.example.attendance.service;

import com.example.attendance.config.AttendanceStatusNatsProperties;
import com.example.common.event.AttendanceStatusChangedPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.impl.Headers;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsAttendanceStatusPublisher implements AttendanceStatusPublisher {

  private final Connection natsConnection;
  private final AttendanceStatusNatsProperties properties;
  private final ObjectMapper objectMapper;

  public NatsAttendanceStatusPublisher(
      Connection natsConnection,
      AttendanceStatusNatsProperties properties,
      ObjectMapper objectMapper) {
    this.natsConnection = natsConnection;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(String tenantId, AttendanceStatusChangedPayload payload) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize attendance status payload", ex);
    }
    // 配信は best-effort のため JetStream ではなく core NATS で publish する
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", payload.eventId());
    if (payload.traceId() != null) {
      headers.add("trace_id", payload.traceId());
    }
    natsConnection.publish(properties.subjectFor(tenantId), headers, body);
  }
}
