/*
 * どこで: Attendance サービス層
 * 何を: 記録済みのステータス変更を通知 payload に変換し、別スレッドで publisher へ渡す
 * なぜ: 配信の遅延や失敗が取り込み処理へ波及しないようにするため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.RecordedAttendance;
import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.common.event.AttendanceStatusChangedPayload;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class AttendanceStatusNotifier {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceStatusNotifier.class);

  private final AttendanceStatusPublisher publisher;
  private final ExecutorService publishExecutor;
  private final AttendanceMetrics metrics;
  private final Clock clock;

  public AttendanceStatusNotifier(
      AttendanceStatusPublisher publisher,
      @Qualifier("attendancePublishExecutor") ExecutorService publishExecutor,
      AttendanceMetrics metrics,
      Clock clock) {
    this.publisher = publisher;
    this.publishExecutor = publishExecutor;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: コミット済みの記録結果を購読者へ通知する。
   * 動作: ステータス投影がない記録は通知しない。失敗は WARN ログとメトリクスに残すだけで再送しない。
   */
  public void notifyChanged(
      RecordedAttendance recorded, String externalId, String displayName, String traceId) {
    if (!recorded.hasStatus()) {
      return;
    }
    final AttendanceStatusChangedPayload payload =
        toPayload(recorded.event(), recorded.status(), externalId, displayName, traceId);
    try {
      publishExecutor.execute(() -> publishQuietly(recorded.event().tenantId(), payload));
    } catch (RejectedExecutionException ex) {
      logger.warn(
          "status publish rejected tenantId={} userId={}",
          recorded.event().tenantId(),
          recorded.event().userId());
      metrics.recordPublishFailure();
    }
  }

  private void publishQuietly(String tenantId, AttendanceStatusChangedPayload payload) {
    try {
      publisher.publish(tenantId, payload);
    } catch (RuntimeException ex) {
      logger.warn(
          "status publish failed tenantId={} userId={} eventId={}",
          tenantId,
          payload.userId(),
          payload.eventId(),
          ex);
      metrics.recordPublishFailure();
    }
  }

  private AttendanceStatusChangedPayload toPayload(
      AttendanceEventRecord event,
      UserAttendanceStatusRecord status,
      String externalId,
      String displayName,
      String traceId) {
    return new AttendanceStatusChangedPayload(
        event.eventId().toString(),
        event.tenantId(),
        event.userId(),
        externalId,
        displayName,
        status.status().value(),
        event.kind().value(),
        event.reason(),
        format(status.expectedReturnAt()),
        format(status.lastCheckInAt()),
        format(status.lastCheckOutAt()),
        Instant.now(clock).toString(),
        traceId);
  }

  private String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
