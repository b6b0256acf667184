/*
 * どこで: AttendanceService の単体テスト
 * 何を: 取り込み経路の入力検証・重複スキップ・分類結果ごとの記録と通知を検証する
 * なぜ: 再配信や未登録の投稿者があっても記録と通知が二重にならないことを保証するため
 */
package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.attendance.classifier.AttendanceClassifierOrchestrator;
import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.BreakReasonCategory;
import com.example.attendance.model.ClassifiedEvent;
import com.example.attendance.model.ClassifierSource;
import com.example.attendance.model.InboundAttendanceMessage;
import com.example.attendance.model.RecordedAttendance;
import com.example.attendance.model.Urgency;
import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.attendance.model.UserIdentity;
import com.example.attendance.model.UserStatus;
import com.example.attendance.repository.AttendanceEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class AttendanceServiceTest {

  private static final String TENANT = "tenant-1";
  private static final String CHANNEL = "channel-1";
  private static final String MESSAGE_ID = "msg-1";
  private static final String AUTHOR = "U123";
  private static final Instant AUTHORED_AT = Instant.parse("2026-03-02T12:00:00Z");
  private static final Instant NOW = Instant.parse("2026-03-02T12:00:02Z");

  @Mock private AttendanceClassifierOrchestrator classifier;
  @Mock private UserIdentityResolver identityResolver;
  @Mock private AttendanceEventRepository eventRepository;
  @Mock private AttendanceEventWriter writer;
  @Mock private AttendanceStatusNotifier notifier;

  @Captor private ArgumentCaptor<AttendanceEventRecord> eventCaptor;

  private SimpleMeterRegistry registry;
  private AttendanceService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new AttendanceService(
            classifier,
            identityResolver,
            eventRepository,
            writer,
            notifier,
            new AttendanceMetrics(registry),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void breakStartIsRecordedWithExpectedReturnAndNotified() {
    final ClassifiedEvent classified =
        new ClassifiedEvent(
            AttendanceEventKind.BREAK_START,
            0.95,
            "doctor appointment, back in 45 min",
            BreakReasonCategory.PERSONAL,
            45,
            Urgency.NORMAL,
            ClassifierSource.RULE);
    when(eventRepository.existsBySource(TENANT, CHANNEL, MESSAGE_ID)).thenReturn(false);
    when(classifier.classify(TENANT, "BRB - doctor appointment, back in 45 min"))
        .thenReturn(classified);
    when(identityResolver.resolve(TENANT, AUTHOR))
        .thenReturn(Optional.of(new UserIdentity("user-1", "Alice")));
    when(writer.record(any(AttendanceEventRecord.class)))
        .thenAnswer(
            invocation -> {
              final AttendanceEventRecord event = invocation.getArgument(0);
              return Optional.of(new RecordedAttendance(event, onBreak(event)));
            });

    final Optional<AttendanceEventRecord> result =
        service.processMessage(message("BRB - doctor appointment, back in 45 min"), "trace-1");

    assertThat(result).isPresent();
    verify(writer).record(eventCaptor.capture());
    final AttendanceEventRecord recorded = eventCaptor.getValue();
    assertThat(recorded.userId()).isEqualTo("user-1");
    assertThat(recorded.kind()).isEqualTo(AttendanceEventKind.BREAK_START);
    assertThat(recorded.eventTime()).isEqualTo(AUTHORED_AT);
    assertThat(recorded.expectedReturnTime()).isEqualTo(AUTHORED_AT.plusSeconds(45 * 60));
    assertThat(recorded.createdAt()).isEqualTo(NOW);
    assertThat(recorded.rawMessage()).isEqualTo("BRB - doctor appointment, back in 45 min");
    assertThat(recorded.actualDurationMinutes()).isNull();
    verify(notifier).notifyChanged(any(RecordedAttendance.class), eq(AUTHOR), eq("Alice"), eq("trace-1"));
    assertThat(
            registry.get("attendance.event.recorded.total").tag("kind", "break_start").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void expectedReturnIsOnlySetForBreakStart() {
    final ClassifiedEvent classified =
        new ClassifiedEvent(
            AttendanceEventKind.CHECK_OUT, 0.9, null, null, 30, Urgency.NORMAL, ClassifierSource.AI);
    when(eventRepository.existsBySource(TENANT, CHANNEL, MESSAGE_ID)).thenReturn(false);
    when(classifier.classify(TENANT, "eod")).thenReturn(classified);
    when(identityResolver.resolve(TENANT, AUTHOR)).thenReturn(Optional.empty());
    when(writer.record(any(AttendanceEventRecord.class)))
        .thenAnswer(invocation -> Optional.of(new RecordedAttendance(invocation.getArgument(0), null)));

    service.processMessage(message("eod"), "trace-1");

    verify(writer).record(eventCaptor.capture());
    assertThat(eventCaptor.getValue().expectedReturnTime()).isNull();
    assertThat(eventCaptor.getValue().userId()).isNull();
  }

  @Test
  void alreadyRecordedMessageIsSkippedBeforeClassification() {
    when(eventRepository.existsBySource(TENANT, CHANNEL, MESSAGE_ID)).thenReturn(true);

    final Optional<AttendanceEventRecord> result = service.processMessage(message("back"), "trace-1");

    assertThat(result).isEmpty();
    verifyNoInteractions(classifier, writer, notifier);
    assertThat(registry.get("attendance.event.duplicate.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void nonAttendanceMessageIsNotRecorded() {
    when(eventRepository.existsBySource(TENANT, CHANNEL, MESSAGE_ID)).thenReturn(false);
    when(classifier.classify(TENANT, "ship it"))
        .thenReturn(ClassifiedEvent.none(ClassifierSource.RULE));

    final Optional<AttendanceEventRecord> result = service.processMessage(message("ship it"), null);

    assertThat(result).isEmpty();
    verifyNoInteractions(writer, notifier, identityResolver);
  }

  @Test
  void concurrentDuplicateIsReportedAsNotRecorded() {
    when(eventRepository.existsBySource(TENANT, CHANNEL, MESSAGE_ID)).thenReturn(false);
    when(classifier.classify(TENANT, "back"))
        .thenReturn(ClassifiedEvent.of(AttendanceEventKind.BREAK_END, 0.95, ClassifierSource.RULE));
    when(identityResolver.resolve(TENANT, AUTHOR))
        .thenReturn(Optional.of(new UserIdentity("user-1", null)));
    when(writer.record(any(AttendanceEventRecord.class))).thenReturn(Optional.empty());

    final Optional<AttendanceEventRecord> result = service.processMessage(message("back"), "trace-1");

    assertThat(result).isEmpty();
    verify(notifier, never()).notifyChanged(any(), anyString(), any(), anyString());
    assertThat(registry.get("attendance.event.duplicate.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void overLongIdentifiersAreRejectedAsPermanentFailure() {
    final String tooLong = "m".repeat(65);
    final InboundAttendanceMessage longMessageId =
        new InboundAttendanceMessage(TENANT, AUTHOR, CHANNEL, tooLong, "back", AUTHORED_AT);
    final InboundAttendanceMessage longChannelId =
        new InboundAttendanceMessage(TENANT, AUTHOR, tooLong, MESSAGE_ID, "back", AUTHORED_AT);

    assertThatThrownBy(() -> service.processMessage(longMessageId, "trace-1"))
        .isInstanceOf(AttendanceMessagePermanentException.class)
        .hasMessage("message_id must be at most 64 characters");
    assertThatThrownBy(() -> service.processMessage(longChannelId, "trace-1"))
        .isInstanceOf(AttendanceMessagePermanentException.class)
        .hasMessage("channel_id must be at most 64 characters");
    verifyNoInteractions(eventRepository, classifier, writer);
  }

  @Test
  void missingFieldsAreRejectedAsPermanentFailure() {
    final InboundAttendanceMessage noChannel =
        new InboundAttendanceMessage(TENANT, AUTHOR, " ", MESSAGE_ID, "back", AUTHORED_AT);
    final InboundAttendanceMessage noTime =
        new InboundAttendanceMessage(TENANT, AUTHOR, CHANNEL, MESSAGE_ID, "back", null);

    assertThatThrownBy(() -> service.processMessage(noChannel, "trace-1"))
        .isInstanceOf(AttendanceMessagePermanentException.class)
        .hasMessage("channel_id is required");
    assertThatThrownBy(() -> service.processMessage(noTime, "trace-1"))
        .isInstanceOf(AttendanceMessagePermanentException.class)
        .hasMessage("authored_at is required");
    verifyNoInteractions(eventRepository, classifier, writer);
  }

  @Test
  void processMessageRestoresCallerMdc() {
    MDC.put("request_id", "req-1");
    when(eventRepository.existsBySource(TENANT, CHANNEL, MESSAGE_ID)).thenReturn(true);

    service.processMessage(message("back"), "trace-1");

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("message_id")).isNull();
  }

  @Test
  void rebuildStatusDelegatesToWriter() {
    final UserAttendanceStatusRecord rebuilt =
        UserAttendanceStatusRecord.initial(TENANT, "user-1").withUpdatedAt(NOW);
    when(writer.rebuildStatus(TENANT, "user-1")).thenReturn(rebuilt);

    assertThat(service.rebuildStatus(TENANT, "user-1")).isEqualTo(rebuilt);
  }

  private InboundAttendanceMessage message(String text) {
    return new InboundAttendanceMessage(TENANT, AUTHOR, CHANNEL, MESSAGE_ID, text, AUTHORED_AT);
  }

  private UserAttendanceStatusRecord onBreak(AttendanceEventRecord event) {
    return new UserAttendanceStatusRecord(
        TENANT,
        event.userId(),
        UserStatus.ON_BREAK,
        null,
        null,
        event.eventTime(),
        event.reason(),
        event.expectedReturnTime(),
        null,
        1,
        0,
        event.createdAt());
  }
}
