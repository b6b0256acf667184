/*
 * どこで: AttendanceStatusNotifier の単体テスト
 * 何を: 通知 payload の組み立てと、publish 失敗/拒否時に例外を外へ出さないことを検証する
 * なぜ: 通知の失敗が取り込み処理の結果を変えないことを保証するため
 */
package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.BreakReasonCategory;
import com.example.attendance.model.ClassifierSource;
import com.example.attendance.model.RecordedAttendance;
import com.example.attendance.model.Urgency;
import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.attendance.model.UserStatus;
import com.example.common.event.AttendanceStatusChangedPayload;
import com.google.common.util.concurrent.MoreExecutors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AttendanceStatusNotifierTest {

  private static final String TENANT = "tenant-1";
  private static final Instant NOW = Instant.parse("2026-03-02T12:00:05Z");
  private static final Instant BREAK_AT = Instant.parse("2026-03-02T12:00:00Z");
  private static final Instant RETURN_AT = Instant.parse("2026-03-02T12:45:00Z");

  private AttendanceStatusPublisher publisher;
  private SimpleMeterRegistry registry;

  @BeforeEach
  void setUp() {
    publisher = mock(AttendanceStatusPublisher.class);
    registry = new SimpleMeterRegistry();
  }

  @Test
  void publishesPayloadBuiltFromEventAndStatus() {
    final AttendanceStatusNotifier notifier = notifier(MoreExecutors.newDirectExecutorService());

    final RecordedAttendance recorded = recorded("user-1");
    notifier.notifyChanged(recorded, "U123", "Alice", "trace-1");

    final ArgumentCaptor<AttendanceStatusChangedPayload> captor =
        ArgumentCaptor.forClass(AttendanceStatusChangedPayload.class);
    verify(publisher).publish(eq(TENANT), captor.capture());
    final AttendanceStatusChangedPayload payload = captor.getValue();
    assertThat(payload.eventId()).isEqualTo(recorded.event().eventId().toString());
    assertThat(payload.tenantId()).isEqualTo(TENANT);
    assertThat(payload.userId()).isEqualTo("user-1");
    assertThat(payload.externalId()).isEqualTo("U123");
    assertThat(payload.displayName()).isEqualTo("Alice");
    assertThat(payload.status()).isEqualTo("on_break");
    assertThat(payload.eventType()).isEqualTo("break_start");
    assertThat(payload.reason()).isEqualTo("lunch");
    assertThat(payload.expectedReturnAt()).isEqualTo(RETURN_AT.toString());
    assertThat(payload.lastCheckinAt()).isEqualTo("2026-03-02T09:00:00Z");
    assertThat(payload.lastCheckoutAt()).isNull();
    assertThat(payload.occurredAt()).isEqualTo(NOW.toString());
    assertThat(payload.traceId()).isEqualTo("trace-1");
  }

  @Test
  void skipsRecordsWithoutStatus() {
    final AttendanceStatusNotifier notifier = notifier(MoreExecutors.newDirectExecutorService());

    notifier.notifyChanged(new RecordedAttendance(event(null), null), "U999", null, "trace-1");

    verifyNoInteractions(publisher);
  }

  @Test
  void publishFailureIsCountedAndNotPropagated() {
    doThrow(new IllegalStateException("nats down")).when(publisher).publish(eq(TENANT), any());
    final AttendanceStatusNotifier notifier = notifier(MoreExecutors.newDirectExecutorService());

    assertThatCode(() -> notifier.notifyChanged(recorded("user-1"), "U123", null, "trace-1"))
        .doesNotThrowAnyException();
    assertThat(registry.get("attendance.status.publish.failure.total").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void rejectedExecutionIsCountedAndNotPropagated() {
    final ExecutorService executor = MoreExecutors.newDirectExecutorService();
    executor.shutdown();
    final AttendanceStatusNotifier notifier = notifier(executor);

    assertThatCode(() -> notifier.notifyChanged(recorded("user-1"), "U123", null, "trace-1"))
        .doesNotThrowAnyException();
    verifyNoInteractions(publisher);
    assertThat(registry.get("attendance.status.publish.failure.total").counter().count())
        .isEqualTo(1.0);
  }

  private AttendanceStatusNotifier notifier(ExecutorService executor) {
    return new AttendanceStatusNotifier(
        publisher, executor, new AttendanceMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private RecordedAttendance recorded(String userId) {
    final AttendanceEventRecord event = event(userId);
    final UserAttendanceStatusRecord status =
        new UserAttendanceStatusRecord(
            TENANT,
            userId,
            UserStatus.ON_BREAK,
            Instant.parse("2026-03-02T09:00:00Z"),
            null,
            BREAK_AT,
            "lunch",
            RETURN_AT,
            Instant.parse("2026-03-02T09:00:00Z"),
            1,
            0,
            BREAK_AT);
    return new RecordedAttendance(event, status);
  }

  private AttendanceEventRecord event(String userId) {
    return new AttendanceEventRecord(
        UUID.randomUUID(),
        TENANT,
        userId,
        AttendanceEventKind.BREAK_START,
        0.95,
        "lunch",
        BreakReasonCategory.MEAL,
        Urgency.NORMAL,
        ClassifierSource.RULE,
        BREAK_AT,
        RETURN_AT,
        null,
        "channel-1",
        "msg-1",
        "brb - lunch",
        BREAK_AT);
  }
}
