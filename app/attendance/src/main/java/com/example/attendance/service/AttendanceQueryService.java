/*
 * どこで: Attendance サービス層
 * 何を: 現在状態・履歴・パターン分析・集計の参照系を提供する
 * なぜ: レポート/ダッシュボード側が監査ログと現在状態だけから一貫した値を得られるようにするため
 */
package com.example.attendance.service;

import com.example.attendance.api.InvalidAttendanceRequestException;
import com.example.attendance.api.response.AttendanceEventResponse;
import com.example.attendance.api.response.AttendanceSummaryResponse;
import com.example.attendance.api.response.TeamPatternSummary;
import com.example.attendance.api.response.TeamStatusResponse;
import com.example.attendance.api.response.TodayStats;
import com.example.attendance.api.response.UserPatternSummary;
import com.example.attendance.api.response.UserStatusResponse;
import com.example.attendance.config.AttendanceAnalyticsProperties;
import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.attendance.model.UserStatus;
import com.example.attendance.repository.AttendanceEventRepository;
import com.example.attendance.repository.UserAttendanceStatusRepository;
import com.example.attendance.repository.UserIdentityRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AttendanceQueryService {

  static final int HISTORY_MIN_DAYS = 1;
  static final int HISTORY_MAX_DAYS = 90;
  static final int PATTERN_MIN_DAYS = 7;
  static final int PATTERN_MAX_DAYS = 90;
  static final int SUMMARY_MIN_DAYS = 1;
  static final int SUMMARY_MAX_DAYS = 30;

  private final AttendanceEventRepository eventRepository;
  private final UserAttendanceStatusRepository statusRepository;
  private final UserIdentityRepository identityRepository;
  private final AttendancePatternAnalyzer patternAnalyzer;
  private final AttendanceAnalyticsProperties analyticsProperties;
  private final Clock clock;

  public TeamStatusResponse getTeamStatus(String tenantId) {
    final List<UserAttendanceStatusRecord> statuses = statusRepository.findByTenant(tenantId);
    final Map<String, String> names =
        identityRepository.findDisplayNames(
            tenantId,
            statuses.stream().map(UserAttendanceStatusRecord::userId).collect(Collectors.toSet()));

    final Map<String, Long> summary = new LinkedHashMap<>();
    for (UserStatus status : UserStatus.values()) {
      summary.put(status.value(), 0L);
    }
    statuses.forEach(status -> summary.merge(status.status().value(), 1L, Long::sum));

    final List<UserStatusResponse> members =
        statuses.stream()
            .map(status -> toUserStatusResponse(status, names.get(status.userId())))
            .sorted(
                Comparator.comparing(
                        UserStatusResponse::displayName,
                        Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                    .thenComparing(UserStatusResponse::userId))
            .toList();
    return new TeamStatusResponse(members, summary);
  }

  public List<AttendanceEventResponse> getUserHistory(String tenantId, String userId, int days) {
    requireDays(days, HISTORY_MIN_DAYS, HISTORY_MAX_DAYS);
    return eventRepository.findByUserSince(tenantId, userId, since(days)).stream()
        .map(this::toEventResponse)
        .toList();
  }

  public UserPatternSummary getUserPatterns(String tenantId, String userId, int days) {
    requireDays(days, PATTERN_MIN_DAYS, PATTERN_MAX_DAYS);
    final List<AttendanceEventRecord> events =
        eventRepository.findByUserSince(tenantId, userId, since(days));
    return patternAnalyzer.summarizeUser(userId, events, days, analyticsProperties.zoneId());
  }

  public AttendanceSummaryResponse getSummary(String tenantId, int days) {
    requireDays(days, SUMMARY_MIN_DAYS, SUMMARY_MAX_DAYS);
    final Instant since = since(days);
    final Map<AttendanceEventKind, Long> counts = eventRepository.countByKindSince(tenantId, since);
    final Map<String, Long> eventCounts = new LinkedHashMap<>();
    counts.forEach((kind, count) -> eventCounts.put(kind.value(), count));
    final long total = counts.values().stream().mapToLong(Long::longValue).sum();
    return new AttendanceSummaryResponse(
        days, eventCounts, eventRepository.countDistinctUsersSince(tenantId, since), total);
  }

  public TeamPatternSummary getInsights(String tenantId, int days) {
    requireDays(days, PATTERN_MIN_DAYS, PATTERN_MAX_DAYS);
    final List<AttendanceEventRecord> events =
        eventRepository.findResolvedByTenantSince(tenantId, since(days));
    final Set<String> userIds =
        events.stream().map(AttendanceEventRecord::userId).collect(Collectors.toSet());
    return patternAnalyzer.summarizeTeam(
        events,
        identityRepository.findDisplayNames(tenantId, userIds),
        days,
        analyticsProperties.zoneId());
  }

  public UserStatusResponse describeStatus(UserAttendanceStatusRecord status) {
    final Map<String, String> names =
        identityRepository.findDisplayNames(status.tenantId(), Set.of(status.userId()));
    return toUserStatusResponse(status, names.get(status.userId()));
  }

  private UserStatusResponse toUserStatusResponse(
      UserAttendanceStatusRecord status, String displayName) {
    return new UserStatusResponse(
        status.userId(),
        displayName,
        status.status().value(),
        status.lastCheckInAt(),
        status.lastCheckOutAt(),
        status.lastBreakStartAt(),
        status.currentBreakReason(),
        status.expectedReturnAt(),
        new TodayStats(
            status.todayCheckInAt(), status.todayBreakCount(), status.todayTotalBreakMinutes()));
  }

  public AttendanceEventResponse toEventResponse(AttendanceEventRecord event) {
    return new AttendanceEventResponse(
        event.eventId().toString(),
        event.kind().value(),
        event.eventTime(),
        event.reason(),
        event.reasonCategory() == null ? null : event.reasonCategory().value(),
        event.actualDurationMinutes(),
        event.confidence(),
        event.source().value());
  }

  private Instant since(int days) {
    return Instant.now(clock).minus(Duration.ofDays(days));
  }

  private void requireDays(int days, int min, int max) {
    if (days < min || days > max) {
      throw new InvalidAttendanceRequestException(
          "days must be between " + min + " and " + max);
    }
  }
}
