/*
 * どこで: Attendance NATS 購読
 * 何を: 勤怠チャンネルの投稿イベントを JetStream から購読し、取り込み処理へ渡す
 * なぜ: チャット連携側と疎結合に投稿を受け取り、失敗時は JetStream の再配信に任せるため
 */
package com.example.attendance.nats;

import com.example.attendance.config.AttendanceInboundNatsProperties;
import com.example.attendance.model.InboundAttendanceMessage;
import com.example.attendance.service.AttendanceMessagePermanentException;
import com.example.attendance.service.AttendanceService;
import com.example.common.event.AttendanceMessagePayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class AttendanceMessageSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceMessageSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final AttendanceService attendanceService;
  private final AttendanceInboundNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public AttendanceMessageSubscriber(
      Connection connection,
      AttendanceService attendanceService,
      AttendanceInboundNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.attendanceService = attendanceService;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "attendance subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    try {
      final AttendanceMessagePayload payload = parsePayload(message.getData());
      attendanceService.processMessage(toInboundMessage(payload), payload.traceId());
      // 勤怠に該当しない投稿や記録済みの投稿も ack して再配信を止める
      message.ack();
    } catch (AttendanceMessagePermanentException ex) {
      // 形式不正は再配信しても回復しないため TERM する
      logger.warn("permanent failure while handling attendance message: {}", ex.getMessage());
      termSilently(message);
    } catch (DataAccessException ex) {
      // DB の一時的失敗は再配信させる (max-deliver 到達で打ち切られる)
      logger.warn("temporary failure while handling attendance message", ex);
      nakSilently(message);
    } catch (RuntimeException ex) {
      // 不明な例外はデータロス回避のため再配信に倒す
      logger.warn("failed to handle attendance message", ex);
      nakSilently(message);
    }
  }

  private AttendanceMessagePayload parsePayload(byte[] data) {
    if (data == null || data.length == 0) {
      throw new AttendanceMessagePermanentException("attendance message payload is empty");
    }
    try {
      return objectMapper.readValue(data, AttendanceMessagePayload.class);
    } catch (IOException ex) {
      throw new AttendanceMessagePermanentException("failed to parse attendance message payload", ex);
    }
  }

  private InboundAttendanceMessage toInboundMessage(AttendanceMessagePayload payload) {
    return new InboundAttendanceMessage(
        payload.tenantId(),
        payload.authorId(),
        payload.channelId(),
        payload.messageId(),
        payload.content(),
        parseAuthoredAt(payload.authoredAt()));
  }

  private Instant parseAuthoredAt(String authoredAt) {
    if (authoredAt == null || authoredAt.isBlank()) {
      throw new AttendanceMessagePermanentException("authored_at is required");
    }
    try {
      return Instant.parse(authoredAt);
    } catch (DateTimeParseException ex) {
      throw new AttendanceMessagePermanentException("invalid authored_at", ex);
    }
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    // Nats-Msg-Id による重複排除を有効化するため stream を必ず作成する
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "attendance stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack nats message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
