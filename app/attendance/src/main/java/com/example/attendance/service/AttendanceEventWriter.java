/*
 * どこで: Attendance サービス層
 * 何を: 監査イベントの追記・休憩実績時間の補正・ステータス更新を 1 トランザクションで行う
 * なぜ: 途中失敗で監査ログと現在状態が食い違わないようにし、同一ユーザーの更新を直列化するため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.RecordedAttendance;
import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.attendance.repository.AttendanceEventRepository;
import com.example.attendance.repository.UserAttendanceStatusRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AttendanceEventWriter {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceEventWriter.class);

  private final AttendanceEventRepository eventRepository;
  private final UserAttendanceStatusRepository statusRepository;
  private final AttendanceStatusTransitions transitions;
  private final AttendanceLockKeyGenerator lockKeyGenerator;
  private final Clock clock;

  /**
   * 役割: 分類済みイベントを記録し、ユーザーが解決済みなら現在状態へ反映する。
   * 動作: 同一投稿が既に記録済みなら何もせず空を返す。DB 例外はロールバックして呼び出し側へ伝播する。
   */
  @Transactional
  public Optional<RecordedAttendance> record(AttendanceEventRecord event) {
    if (!event.hasUser()) {
      // 投稿者が未解決でも監査ログには残す (ステータス投影は対象ユーザーがいないので行わない)
      return eventRepository
          .insertIfAbsent(event)
          .map(inserted -> new RecordedAttendance(inserted, null));
    }

    // 同一ユーザーの読み取り〜更新を直列化してから重複判定する。
    statusRepository.lockByKey(lockKeyGenerator.generate(event.tenantId(), event.userId()));
    final Optional<Instant> latestEventTime =
        eventRepository.findLatestEventTime(event.tenantId(), event.userId());
    final Optional<AttendanceEventRecord> inserted = eventRepository.insertIfAbsent(event);
    if (inserted.isEmpty()) {
      return Optional.empty();
    }

    final UserAttendanceStatusRecord current =
        statusRepository
            .findByTenantAndUser(event.tenantId(), event.userId())
            .orElseGet(() -> UserAttendanceStatusRecord.initial(event.tenantId(), event.userId()));
    final UserAttendanceStatusRecord next;
    if (latestEventTime.isPresent() && event.eventTime().isBefore(latestEventTime.get())) {
      logger.info(
          "out-of-order attendance event, replaying log eventTime={} latestEventTime={}",
          event.eventTime(),
          latestEventTime.get());
      next = replayLateEvent(current, event);
    } else {
      final StatusTransition transition = transitions.apply(current, event);
      if (transition.hasReconciliation()) {
        reconcile(event.tenantId(), event.userId(), transition);
      }
      next = transition.next();
    }
    statusRepository.upsert(next);
    return Optional.of(new RecordedAttendance(inserted.get(), next));
  }

  /** 監査ログを再生してユーザーの現在状態を作り直す。日次カウンタもログから再計算される。 */
  @Transactional
  public UserAttendanceStatusRecord rebuildStatus(String tenantId, String userId) {
    statusRepository.lockByKey(lockKeyGenerator.generate(tenantId, userId));
    final UserAttendanceStatusRecord rebuilt =
        replayLog(tenantId, userId, eventRepository.findAllByUserInEventOrder(tenantId, userId))
            .withUpdatedAt(Instant.now(clock));
    statusRepository.upsert(rebuilt);
    return rebuilt;
  }

  /**
   * 役割: 既存イベントより古い発生時刻で届いたイベントを、監査ログの再生で現在状態へ反映する。
   * 動作: 日次カウンタは遅延イベントによる増分だけを現在値へ足すので、日次リセット後の値はログ全体から作り直さない。
   */
  private UserAttendanceStatusRecord replayLateEvent(
      UserAttendanceStatusRecord current, AttendanceEventRecord late) {
    final List<AttendanceEventRecord> log =
        eventRepository.findAllByUserInEventOrder(late.tenantId(), late.userId());
    final List<AttendanceEventRecord> withoutLate =
        log.stream().filter(e -> !e.eventId().equals(late.eventId())).toList();
    final UserAttendanceStatusRecord before =
        transitions.replay(late.tenantId(), late.userId(), withoutLate);
    final UserAttendanceStatusRecord after = replayLog(late.tenantId(), late.userId(), log);

    final Instant todayCheckInAt =
        Objects.equals(before.todayCheckInAt(), after.todayCheckInAt())
            ? current.todayCheckInAt()
            : after.todayCheckInAt();
    return after
        .withTodayCounters(
            todayCheckInAt,
            current.todayBreakCount() + after.todayBreakCount() - before.todayBreakCount(),
            current.todayTotalBreakMinutes()
                + after.todayTotalBreakMinutes()
                - before.todayTotalBreakMinutes())
        .withUpdatedAt(late.createdAt());
  }

  /** ログ全体を再生し、休憩開始イベントの実績時間も再生結果で書き直す。 */
  private UserAttendanceStatusRecord replayLog(
      String tenantId, String userId, List<AttendanceEventRecord> log) {
    final List<StatusTransition> steps = transitions.replaySteps(tenantId, userId, log);
    eventRepository.clearBreakStartDurations(tenantId, userId);
    steps.stream()
        .filter(StatusTransition::hasReconciliation)
        .forEach(step -> reconcile(tenantId, userId, step));
    return steps.isEmpty()
        ? UserAttendanceStatusRecord.initial(tenantId, userId)
        : steps.get(steps.size() - 1).next();
  }

  private void reconcile(String tenantId, String userId, StatusTransition transition) {
    final int updated =
        eventRepository.updateLatestBreakStartDuration(
            tenantId,
            userId,
            transition.reconciledBreakStartAt(),
            transition.reconciledBreakMinutes());
    if (updated == 0) {
      logger.debug(
          "no break start event matched for reconciliation breakStartAt={}",
          transition.reconciledBreakStartAt());
    }
  }
}
