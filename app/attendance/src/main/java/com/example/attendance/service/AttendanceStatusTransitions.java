/*
 * どこで: Attendance サービス層
 * 何を: 勤怠イベント 1 件を現在状態へ適用する純粋な遷移関数と、その再生を提供する
 * なぜ: DB 更新と再構築 (監査ログの再生) で同じ遷移規則を共有し、結果を一致させるため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.attendance.model.UserStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class AttendanceStatusTransitions {

  private static final Comparator<AttendanceEventRecord> EVENT_ORDER =
      Comparator.comparing(AttendanceEventRecord::eventTime)
          .thenComparing(
              AttendanceEventRecord::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()));

  /**
   * 役割: 現在状態にイベントを適用した次の状態を返す。
   * 動作: 入力は変更しない。NONE は状態を変えない。休憩終了は休憩開始時刻が記録済みなら実績時間を確定する。
   */
  public StatusTransition apply(UserAttendanceStatusRecord current, AttendanceEventRecord event) {
    final AttendanceEventKind kind = event.kind();
    return switch (kind) {
      case CHECK_IN -> StatusTransition.of(checkIn(current, event));
      case CHECK_OUT -> StatusTransition.of(checkOut(current, event));
      case BREAK_START -> StatusTransition.of(breakStart(current, event));
      case BREAK_END -> breakEnd(current, event);
      case NONE -> StatusTransition.of(current);
    };
  }

  /** 初期状態 (UNKNOWN) から発生時刻順にイベントを畳み込む。 */
  public UserAttendanceStatusRecord replay(
      String tenantId, String userId, List<AttendanceEventRecord> events) {
    final List<StatusTransition> steps = replaySteps(tenantId, userId, events);
    return steps.isEmpty()
        ? UserAttendanceStatusRecord.initial(tenantId, userId)
        : steps.get(steps.size() - 1).next();
  }

  /**
   * 役割: 再生の各ステップの遷移結果を発生時刻順に返す。
   * 動作: 休憩実績時間の補正内容もステップごとに残るので、監査ログ側の実績時間を作り直すのに使える。
   */
  public List<StatusTransition> replaySteps(
      String tenantId, String userId, List<AttendanceEventRecord> events) {
    final List<StatusTransition> steps = new ArrayList<>(events.size());
    UserAttendanceStatusRecord status = UserAttendanceStatusRecord.initial(tenantId, userId);
    for (AttendanceEventRecord event : events.stream().sorted(EVENT_ORDER).toList()) {
      final StatusTransition step = apply(status, event);
      steps.add(step);
      status = step.next();
    }
    return steps;
  }

  private UserAttendanceStatusRecord checkIn(
      UserAttendanceStatusRecord current, AttendanceEventRecord event) {
    return new UserAttendanceStatusRecord(
        current.tenantId(),
        current.userId(),
        UserStatus.ACTIVE,
        event.eventTime(),
        current.lastCheckOutAt(),
        current.lastBreakStartAt(),
        null,
        null,
        event.eventTime(),
        current.todayBreakCount(),
        current.todayTotalBreakMinutes(),
        event.createdAt());
  }

  private UserAttendanceStatusRecord checkOut(
      UserAttendanceStatusRecord current, AttendanceEventRecord event) {
    return new UserAttendanceStatusRecord(
        current.tenantId(),
        current.userId(),
        UserStatus.OFFLINE,
        current.lastCheckInAt(),
        event.eventTime(),
        current.lastBreakStartAt(),
        null,
        null,
        current.todayCheckInAt(),
        current.todayBreakCount(),
        current.todayTotalBreakMinutes(),
        event.createdAt());
  }

  private UserAttendanceStatusRecord breakStart(
      UserAttendanceStatusRecord current, AttendanceEventRecord event) {
    return new UserAttendanceStatusRecord(
        current.tenantId(),
        current.userId(),
        UserStatus.ON_BREAK,
        current.lastCheckInAt(),
        current.lastCheckOutAt(),
        event.eventTime(),
        event.reason(),
        event.expectedReturnTime(),
        current.todayCheckInAt(),
        current.todayBreakCount() + 1,
        current.todayTotalBreakMinutes(),
        event.createdAt());
  }

  private StatusTransition breakEnd(UserAttendanceStatusRecord current, AttendanceEventRecord event) {
    Integer minutes = null;
    if (current.hasBreakStart()) {
      final Duration elapsed = Duration.between(current.lastBreakStartAt(), event.eventTime());
      // 休憩開始より前の時刻で届いた休憩終了は実績時間を記録しない
      if (!elapsed.isNegative()) {
        minutes = Math.toIntExact(elapsed.toMinutes());
      }
    }
    final UserAttendanceStatusRecord next =
        new UserAttendanceStatusRecord(
            current.tenantId(),
            current.userId(),
            UserStatus.ACTIVE,
            current.lastCheckInAt(),
            current.lastCheckOutAt(),
            current.lastBreakStartAt(),
            null,
            null,
            current.todayCheckInAt(),
            current.todayBreakCount(),
            minutes == null
                ? current.todayTotalBreakMinutes()
                : current.todayTotalBreakMinutes() + minutes,
            event.createdAt());
    if (minutes == null) {
      return StatusTransition.of(next);
    }
    return new StatusTransition(next, current.lastBreakStartAt(), minutes);
  }
}
