/*
 * どこで: Attendance サービス層
 * 何を: 勤怠チャンネルの投稿 1 件を分類し、記録・状態更新・通知までを順に実行する
 * なぜ: NATS 購読と HTTP 取り込みが同じ処理経路と冪等性を共有するため
 */
package com.example.attendance.service;

import com.example.attendance.classifier.AttendanceClassifierOrchestrator;
import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.ClassifiedEvent;
import com.example.attendance.model.InboundAttendanceMessage;
import com.example.attendance.model.RecordedAttendance;
import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.attendance.model.UserIdentity;
import com.example.attendance.repository.AttendanceEventRepository;
import com.example.common.TraceIds;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AttendanceService {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceService.class);
  private static final int MAX_IDENTIFIER_LENGTH = 64;

  private final AttendanceClassifierOrchestrator classifier;
  private final UserIdentityResolver identityResolver;
  private final AttendanceEventRepository eventRepository;
  private final AttendanceEventWriter writer;
  private final AttendanceStatusNotifier notifier;
  private final AttendanceMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 投稿 1 件を勤怠イベントとして処理する。
   * 動作: 勤怠に該当しない投稿と既に記録済みの投稿は空を返す。永続化の失敗は例外として呼び出し側へ伝播する。
   */
  public Optional<AttendanceEventRecord> processMessage(
      InboundAttendanceMessage message, String traceId) {
    validate(message);
    final String resolvedTraceId = TraceIds.resolve(traceId);
    // HTTP 経由では RequestMdcInterceptor の MDC が既にあるため、終了時は呼び出し前の状態へ戻す
    final Map<String, String> previousContext = MDC.getCopyOfContextMap();
    MDC.put("tenant_id", message.tenantId());
    MDC.put("message_id", message.messageId());
    MDC.put("trace_id", resolvedTraceId);
    try {
      return process(message, resolvedTraceId);
    } finally {
      if (previousContext == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previousContext);
      }
    }
  }

  /** 監査ログからユーザーの現在状態を作り直す。 */
  public UserAttendanceStatusRecord rebuildStatus(String tenantId, String userId) {
    final UserAttendanceStatusRecord rebuilt = writer.rebuildStatus(tenantId, userId);
    logger.info(
        "attendance status rebuilt tenantId={} userId={} status={}",
        tenantId,
        userId,
        rebuilt.status().value());
    return rebuilt;
  }

  private Optional<AttendanceEventRecord> process(
      InboundAttendanceMessage message, String traceId) {
    // 再配信された投稿で AI 呼び出しを消費しないよう、分類前に記録済みかを確認する
    if (eventRepository.existsBySource(
        message.tenantId(), message.channelId(), message.messageId())) {
      logger.debug("attendance message already recorded");
      metrics.recordDuplicate();
      return Optional.empty();
    }

    final ClassifiedEvent classified = classifier.classify(message.tenantId(), message.text());
    if (classified.isNone()) {
      logger.debug("attendance message is not an attendance event source={}", classified.source());
      return Optional.empty();
    }

    final Optional<UserIdentity> identity =
        identityResolver.resolve(message.tenantId(), message.authorExternalId());
    if (identity.isEmpty()) {
      logger.debug(
          "attendance message author is not mapped authorExternalId={}",
          message.authorExternalId());
    } else {
      MDC.put("user_id", identity.get().userId());
    }

    final AttendanceEventRecord event =
        toEventRecord(message, classified, identity.map(UserIdentity::userId).orElse(null));
    final Optional<RecordedAttendance> recorded = writer.record(event);
    if (recorded.isEmpty()) {
      // 事前確認と記録の間に同じ投稿が別経路で記録された
      logger.debug("attendance message recorded concurrently");
      metrics.recordDuplicate();
      return Optional.empty();
    }

    metrics.recordEventRecorded(event.kind());
    logger.info(
        "attendance event recorded eventType={} source={} confidence={} userResolved={}",
        event.kind().value(),
        event.source().value(),
        event.confidence(),
        event.hasUser());
    notifier.notifyChanged(
        recorded.get(),
        message.authorExternalId(),
        identity.map(UserIdentity::displayName).orElse(null),
        traceId);
    return Optional.of(recorded.get().event());
  }

  private AttendanceEventRecord toEventRecord(
      InboundAttendanceMessage message, ClassifiedEvent classified, String userId) {
    final Instant eventTime = message.authoredAt();
    final Instant expectedReturnTime =
        classified.kind() == AttendanceEventKind.BREAK_START
                && classified.expectedDurationMinutes() != null
            ? eventTime.plus(Duration.ofMinutes(classified.expectedDurationMinutes()))
            : null;
    return new AttendanceEventRecord(
        UUID.randomUUID(),
        message.tenantId(),
        userId,
        classified.kind(),
        classified.confidence(),
        classified.reason(),
        classified.reasonCategory(),
        classified.urgency(),
        classified.source(),
        eventTime,
        expectedReturnTime,
        null,
        message.channelId(),
        message.messageId(),
        message.text() == null ? "" : message.text(),
        Instant.now(clock));
  }

  private void validate(InboundAttendanceMessage message) {
    if (message == null) {
      throw new AttendanceMessagePermanentException("message is required");
    }
    requireText(message.tenantId(), "tenant_id");
    requireText(message.channelId(), "channel_id");
    requireText(message.messageId(), "message_id");
    requireMaxLength(message.tenantId(), "tenant_id");
    requireMaxLength(message.channelId(), "channel_id");
    requireMaxLength(message.messageId(), "message_id");
    if (message.authoredAt() == null) {
      throw new AttendanceMessagePermanentException("authored_at is required");
    }
  }

  private void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new AttendanceMessagePermanentException(field + " is required");
    }
  }

  // attendance_events の識別子列 (VARCHAR(64)) に収まらない値は再配信しても保存できない
  private void requireMaxLength(String value, String field) {
    if (value.length() > MAX_IDENTIFIER_LENGTH) {
      throw new AttendanceMessagePermanentException(
          field + " must be at most " + MAX_IDENTIFIER_LENGTH + " characters");
    }
  }
}
