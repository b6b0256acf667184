/*
 * どこで: Attendance サービス層
 * 何を: 監査ログのイベント列からチーム/個人の勤怠パターンを算出する
 * なぜ: 出勤時刻の傾向や休憩の偏りを、保存済みのイベントだけから再現可能に集計するため
 */
package com.example.attendance.service;

import com.example.attendance.api.response.BreakPattern;
import com.example.attendance.api.response.HourPattern;
import com.example.attendance.api.response.LongBreak;
import com.example.attendance.api.response.MemberAverageTime;
import com.example.attendance.api.response.MemberBreakCount;
import com.example.attendance.api.response.PeakHour;
import com.example.attendance.api.response.ReasonCount;
import com.example.attendance.api.response.TeamInsights;
import com.example.attendance.api.response.TeamPatternSummary;
import com.example.attendance.api.response.UserPatternSummary;
import com.example.attendance.api.response.UserPatterns;
import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.AttendanceEventRecord;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class AttendancePatternAnalyzer {

  static final int PEAK_HOUR_LIMIT = 3;
  static final int REASON_LIMIT = 10;
  static final int LONG_BREAK_LIMIT = 10;
  static final int MEMBER_LIMIT = 5;
  static final int LONG_BREAK_MINUTES = 30;
  // 閾値は標本 2 件以上で算出する (1 件だと標準偏差が常に 0 になる)
  static final int MIN_THRESHOLD_SAMPLES = 2;

  private static final String UNSPECIFIED_REASON = "unspecified";
  private static final String NO_REASON_GIVEN = "No reason given";
  private static final String OTHER_CATEGORY = "other";
  private static final int MINUTES_PER_DAY = 24 * 60;

  /**
   * 役割: テナントのイベント列からチーム全体のパターンを算出する。
   * 動作: 時刻は zone で時間帯へ丸める。平均時刻は線形平均のため日付をまたぐチームでは偏る。
   */
  public TeamPatternSummary summarizeTeam(
      List<AttendanceEventRecord> events,
      Map<String, String> displayNames,
      int periodDays,
      ZoneId zone) {
    if (events.isEmpty()) {
      return TeamPatternSummary.empty(periodDays);
    }
    final Map<Integer, Long> checkinHours = new TreeMap<>();
    final Map<Integer, Long> checkoutHours = new TreeMap<>();
    final Map<Integer, Long> breakHours = new TreeMap<>();
    final Map<String, Long> reasons = new LinkedHashMap<>();
    final List<LongBreak> longBreaks = new ArrayList<>();
    final Map<String, MemberTally> members = new LinkedHashMap<>();

    for (AttendanceEventRecord event : sortedByEventTime(events)) {
      final int hour = event.eventTime().atZone(zone).getHour();
      final MemberTally member =
          members.computeIfAbsent(event.userId(), userId -> new MemberTally());
      switch (event.kind()) {
        case CHECK_IN -> {
          checkinHours.merge(hour, 1L, Long::sum);
          member.checkinHours.add(hour);
        }
        case CHECK_OUT -> {
          checkoutHours.merge(hour, 1L, Long::sum);
          member.checkoutHours.add(hour);
        }
        case BREAK_START -> {
          breakHours.merge(hour, 1L, Long::sum);
          member.breakCount++;
          reasons.merge(reasonLabel(event), 1L, Long::sum);
          final Integer duration = event.actualDurationMinutes();
          if (duration != null && duration > LONG_BREAK_MINUTES) {
            longBreaks.add(
                new LongBreak(
                    event.userId(),
                    displayNames.get(event.userId()),
                    duration,
                    event.reason() == null ? NO_REASON_GIVEN : event.reason(),
                    event.eventTime()));
          }
        }
        default -> {
          // BREAK_END / NONE は時間帯集計の対象外
        }
      }
    }

    final BreakPattern breakPattern =
        new BreakPattern(
            peakHours(breakHours),
            averageHour(breakHours),
            hourDistribution(breakHours),
            topReasons(reasons),
            longBreaks.stream()
                .sorted(Comparator.comparingInt(LongBreak::durationMinutes).reversed())
                .limit(LONG_BREAK_LIMIT)
                .toList());
    return new TeamPatternSummary(
        periodDays,
        true,
        null,
        toHourPattern(checkinHours),
        toHourPattern(checkoutHours),
        breakPattern,
        teamInsights(members, displayNames));
  }

  /**
   * 役割: 1 ユーザーのイベント列から個人パターンを算出する。
   * 動作: イベントが 0 件なら patterns=null。平均時刻は分単位 (minute-of-day) の線形平均。
   */
  public UserPatternSummary summarizeUser(
      String userId, List<AttendanceEventRecord> events, int periodDays, ZoneId zone) {
    if (events.isEmpty()) {
      return UserPatternSummary.notEnoughData(userId, periodDays);
    }
    final List<AttendanceEventRecord> sorted = sortedByEventTime(events);
    final List<Double> checkinMinutes = minutesOfDay(sorted, AttendanceEventKind.CHECK_IN, zone);
    final List<Double> checkoutMinutes = minutesOfDay(sorted, AttendanceEventKind.CHECK_OUT, zone);
    final List<AttendanceEventRecord> breaks =
        sorted.stream().filter(event -> event.kind() == AttendanceEventKind.BREAK_START).toList();

    Double avgBreaksPerDay = null;
    Map<String, Double> distribution = null;
    Double avgBreakDuration = null;
    Integer longBreakThreshold = null;
    if (!breaks.isEmpty()) {
      avgBreaksPerDay = roundToTenth((double) breaks.size() / periodDays);
      distribution = reasonDistribution(breaks);
      final List<Double> durations =
          breaks.stream()
              .map(AttendanceEventRecord::actualDurationMinutes)
              .filter(duration -> duration != null && duration > 0)
              .map(Integer::doubleValue)
              .toList();
      if (!durations.isEmpty()) {
        avgBreakDuration = roundToTenth(mean(durations));
      }
      if (durations.size() >= MIN_THRESHOLD_SAMPLES) {
        longBreakThreshold = (int) Math.ceil(mean(durations) + standardDeviation(durations));
      }
    }

    final String lateCheckinThreshold =
        checkinMinutes.size() >= MIN_THRESHOLD_SAMPLES
            ? formatMinuteOfDay(
                Math.min(
                    MINUTES_PER_DAY - 1,
                    mean(checkinMinutes) + standardDeviation(checkinMinutes)))
            : null;

    final UserPatterns patterns =
        new UserPatterns(
            checkinMinutes.size(),
            checkoutMinutes.size(),
            breaks.size(),
            checkinMinutes.isEmpty() ? null : formatMinuteOfDay(mean(checkinMinutes)),
            checkoutMinutes.isEmpty() ? null : formatMinuteOfDay(mean(checkoutMinutes)),
            avgBreaksPerDay,
            distribution,
            avgBreakDuration,
            lateCheckinThreshold,
            longBreakThreshold);
    return new UserPatternSummary(userId, periodDays, patterns, null);
  }

  private HourPattern toHourPattern(Map<Integer, Long> hours) {
    return new HourPattern(peakHours(hours), averageHour(hours), hourDistribution(hours));
  }

  private List<PeakHour> peakHours(Map<Integer, Long> hours) {
    // TreeMap の昇順を保ったまま件数降順に並べるので、同数は早い時間帯が先になる
    return hours.entrySet().stream()
        .sorted(Map.Entry.<Integer, Long>comparingByValue().reversed())
        .limit(PEAK_HOUR_LIMIT)
        .map(entry -> new PeakHour(entry.getKey(), entry.getValue(), formatHour(entry.getKey())))
        .toList();
  }

  private String averageHour(Map<Integer, Long> hours) {
    if (hours.isEmpty()) {
      return null;
    }
    long weighted = 0;
    long count = 0;
    for (Map.Entry<Integer, Long> entry : hours.entrySet()) {
      weighted += entry.getKey() * entry.getValue();
      count += entry.getValue();
    }
    return formatFractionalHour((double) weighted / count);
  }

  private Map<String, Long> hourDistribution(Map<Integer, Long> hours) {
    final Map<String, Long> distribution = new LinkedHashMap<>();
    hours.forEach((hour, count) -> distribution.put(formatHour(hour), count));
    return distribution;
  }

  private List<ReasonCount> topReasons(Map<String, Long> reasons) {
    return reasons.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
        .limit(REASON_LIMIT)
        .map(entry -> new ReasonCount(entry.getKey(), entry.getValue()))
        .toList();
  }

  private TeamInsights teamInsights(Map<String, MemberTally> members, Map<String, String> names) {
    final List<MemberAverageTime> earlyBirds = new ArrayList<>();
    final List<MemberAverageTime> nightOwls = new ArrayList<>();
    final List<MemberBreakCount> breakCounts = new ArrayList<>();
    members.forEach(
        (userId, tally) -> {
          if (!tally.checkinHours.isEmpty()) {
            final double average = meanOfInts(tally.checkinHours);
            earlyBirds.add(
                new MemberAverageTime(
                    userId, names.get(userId), average, formatFractionalHour(average)));
          }
          if (!tally.checkoutHours.isEmpty()) {
            final double average = meanOfInts(tally.checkoutHours);
            nightOwls.add(
                new MemberAverageTime(
                    userId, names.get(userId), average, formatFractionalHour(average)));
          }
          breakCounts.add(new MemberBreakCount(userId, names.get(userId), tally.breakCount));
        });
    return new TeamInsights(
        earlyBirds.stream()
            .sorted(Comparator.comparingDouble(MemberAverageTime::averageHour))
            .limit(MEMBER_LIMIT)
            .toList(),
        nightOwls.stream()
            .sorted(Comparator.comparingDouble(MemberAverageTime::averageHour).reversed())
            .limit(MEMBER_LIMIT)
            .toList(),
        breakCounts.stream()
            .sorted(Comparator.comparingInt(MemberBreakCount::breakCount).reversed())
            .limit(MEMBER_LIMIT)
            .toList());
  }

  private Map<String, Double> reasonDistribution(List<AttendanceEventRecord> breaks) {
    final Map<String, Long> counts = new LinkedHashMap<>();
    for (AttendanceEventRecord event : breaks) {
      final String category =
          event.reasonCategory() == null ? OTHER_CATEGORY : event.reasonCategory().value();
      counts.merge(category, 1L, Long::sum);
    }
    final Map<String, Double> distribution = new LinkedHashMap<>();
    counts.forEach(
        (category, count) ->
            distribution.put(category, roundToTenth(count * 100.0 / breaks.size())));
    return distribution;
  }

  private String reasonLabel(AttendanceEventRecord event) {
    if (event.reasonCategory() != null) {
      return event.reasonCategory().value();
    }
    if (event.reason() != null && !event.reason().isBlank()) {
      return event.reason();
    }
    return UNSPECIFIED_REASON;
  }

  private List<Double> minutesOfDay(
      List<AttendanceEventRecord> events, AttendanceEventKind kind, ZoneId zone) {
    return events.stream()
        .filter(event -> event.kind() == kind)
        .map(
            event -> {
              final ZonedDateTime local = event.eventTime().atZone(zone);
              return (double) (local.getHour() * 60 + local.getMinute());
            })
        .toList();
  }

  private List<AttendanceEventRecord> sortedByEventTime(List<AttendanceEventRecord> events) {
    return events.stream()
        .sorted(Comparator.comparing(AttendanceEventRecord::eventTime))
        .toList();
  }

  private double mean(List<Double> values) {
    double sum = 0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.size();
  }

  private double meanOfInts(List<Integer> values) {
    double sum = 0;
    for (int value : values) {
      sum += value;
    }
    return sum / values.size();
  }

  // 母標準偏差
  private double standardDeviation(List<Double> values) {
    final double mean = mean(values);
    double squared = 0;
    for (double value : values) {
      squared += (value - mean) * (value - mean);
    }
    return Math.sqrt(squared / values.size());
  }

  private double roundToTenth(double value) {
    return Math.round(value * 10.0) / 10.0;
  }

  private String formatHour(int hour) {
    return String.format(Locale.ROOT, "%02d:00", hour);
  }

  private String formatFractionalHour(double hour) {
    final int hours = (int) hour;
    final int minutes = (int) ((hour - hours) * 60);
    return String.format(Locale.ROOT, "%02d:%02d", hours, minutes);
  }

  private String formatMinuteOfDay(double minuteOfDay) {
    final int minutes = (int) minuteOfDay;
    return String.format(Locale.ROOT, "%02d:%02d", minutes / 60, minutes % 60);
  }

  private static final class MemberTally {
    private final List<Integer> checkinHours = new ArrayList<>();
    private final List<Integer> checkoutHours = new ArrayList<>();
    private int breakCount;
  }
}
