/*
 * どこで: Attendance 分類層
 * 何を: 定型フレーズの正規表現で投稿を出勤/退勤/休憩開始/休憩終了に分類する
 * なぜ: AI が使えない時でも決定的に分類でき、取り込みを止めないため
 */
package com.example.attendance.classifier;

import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.BreakReasonCategory;
import com.example.attendance.model.ClassifiedEvent;
import com.example.attendance.model.ClassifierSource;
import com.example.attendance.model.Urgency;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class RuleBasedAttendanceClassifier implements AttendanceClassifier {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
  private static final double HIGH_CONFIDENCE = 0.95;
  private static final double DEFAULT_CONFIDENCE = 0.85;
  private static final int MINUTES_PER_HOUR = 60;

  private static final List<Pattern> CHECK_IN_PATTERNS =
      List.of(
          Pattern.compile("^[✅☑️✓]?\\s*available\\s*$", FLAGS),
          Pattern.compile("^(good\\s*morning|gm|online|in)\\s*[!.]?\\s*$", FLAGS),
          Pattern.compile("^(hello|hi|hey)\\s*(everyone|team|all)?[!.]?\\s*$", FLAGS));

  private static final List<Pattern> CHECK_OUT_PATTERNS =
      List.of(
          Pattern.compile("^[👋🖐️✋🌙]?\\s*signing\\s*out\\s*$", FLAGS),
          Pattern.compile(
              "^(logging\\s*off|log\\s*off|out|eod|end\\s*of\\s*day)\\s*[!.]?\\s*$", FLAGS),
          Pattern.compile("^(good\\s*night|gn|bye|leaving|done)\\s*[!.]?\\s*$", FLAGS));

  private static final List<BreakStartRule> BREAK_START_RULES =
      List.of(
          BreakStartRule.withReason("^brb(?:\\s*[-–—:]\\s*(?<reason>.+))?\\s*$"),
          BreakStartRule.withoutReason("^(break|afk|lunch|stepping\\s*out)\\s*$"),
          BreakStartRule.withReason(
              "^(taking\\s*(?:a\\s*)?break)\\s*[-–—:]?\\s*(?<reason>.*)$"));

  private static final List<Pattern> BREAK_END_PATTERNS =
      List.of(
          Pattern.compile("^back\\s*[!.]?\\s*$", FLAGS),
          Pattern.compile("^(i'?m\\s*back|here|returned|resuming)\\s*[!.]?\\s*$", FLAGS));

  // 判定順がそのまま優先順位になる
  private static final Map<BreakReasonCategory, List<String>> CATEGORY_KEYWORDS =
      Map.of(
          BreakReasonCategory.MEAL,
          List.of("lunch", "dinner", "breakfast", "eat", "food", "meal", "snack", "coffee"),
          BreakReasonCategory.PERSONAL,
          List.of(
              "errand", "appointment", "doctor", "dentist", "pickup", "drop", "bank", "store",
              "daughter", "son", "kid", "child", "family"),
          BreakReasonCategory.REST,
          List.of("rest", "nap", "tired", "break", "stretch", "walk"),
          BreakReasonCategory.MEETING,
          List.of("meeting", "call", "standup", "sync", "interview"),
          BreakReasonCategory.EMERGENCY,
          List.of("emergency", "urgent", "asap", "important"));

  private static final List<BreakReasonCategory> CATEGORY_ORDER =
      List.of(
          BreakReasonCategory.MEAL,
          BreakReasonCategory.PERSONAL,
          BreakReasonCategory.REST,
          BreakReasonCategory.MEETING,
          BreakReasonCategory.EMERGENCY);

  private static final Pattern MINUTES_PATTERN =
      Pattern.compile("(\\d+)\\s*(?:min(?:ute)?s?|m)\\b", FLAGS);
  private static final Pattern HOURS_PATTERN = Pattern.compile("(\\d+)\\s*(?:hour?s?|hr?s?)\\b", FLAGS);
  private static final Pattern BACK_IN_PATTERN = Pattern.compile("(?:in|back\\s*in)\\s*(\\d+)", FLAGS);

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public Optional<ClassifiedEvent> classify(String text) {
    return Optional.of(classifyOrNone(text));
  }

  /**
   * 役割: 投稿テキストを決定的に分類する。
   * 動作: 出勤 → 退勤 → 休憩開始 → 休憩終了の順に照合し、最初に一致した種別を返す。一致しなければ NONE。
   */
  public ClassifiedEvent classifyOrNone(String text) {
    final String message = text == null ? "" : text.strip();
    if (message.isEmpty()) {
      return ClassifiedEvent.none(ClassifierSource.RULE);
    }
    final String lower = message.toLowerCase(Locale.ROOT);

    if (matchesAny(CHECK_IN_PATTERNS, message)) {
      return ClassifiedEvent.of(
          AttendanceEventKind.CHECK_IN, confidenceWhen(lower.contains("available")), ClassifierSource.RULE);
    }
    if (matchesAny(CHECK_OUT_PATTERNS, message)) {
      return ClassifiedEvent.of(
          AttendanceEventKind.CHECK_OUT,
          confidenceWhen(lower.contains("signing out")),
          ClassifierSource.RULE);
    }
    for (BreakStartRule rule : BREAK_START_RULES) {
      final Matcher matcher = rule.pattern().matcher(message);
      if (matcher.matches()) {
        return breakStart(rule.reason(matcher), lower.contains("brb"));
      }
    }
    if (matchesAny(BREAK_END_PATTERNS, message)) {
      return ClassifiedEvent.of(
          AttendanceEventKind.BREAK_END, confidenceWhen(lower.equals("back")), ClassifierSource.RULE);
    }
    return ClassifiedEvent.none(ClassifierSource.RULE);
  }

  private ClassifiedEvent breakStart(String rawReason, boolean brb) {
    final String reason = rawReason == null || rawReason.isBlank() ? null : rawReason.strip();
    return new ClassifiedEvent(
        AttendanceEventKind.BREAK_START,
        confidenceWhen(brb),
        reason,
        categorize(reason),
        extractDurationMinutes(reason),
        detectUrgency(reason),
        ClassifierSource.RULE);
  }

  @VisibleForTesting
  BreakReasonCategory categorize(String reason) {
    if (reason == null || reason.isBlank()) {
      return null;
    }
    final String lower = reason.toLowerCase(Locale.ROOT);
    for (BreakReasonCategory category : CATEGORY_ORDER) {
      if (containsAny(lower, CATEGORY_KEYWORDS.get(category))) {
        return category;
      }
    }
    return BreakReasonCategory.OTHER;
  }

  /**
   * 役割: 理由テキストから予定休憩時間 (分) を抽出する。
   * 動作: 分表記 → 時間表記 (×60) → "in N" の順に探し、480 分を超える値は捨てて次の表記を試す。
   */
  @VisibleForTesting
  Integer extractDurationMinutes(String reason) {
    if (reason == null || reason.isBlank()) {
      return null;
    }
    final Integer minutes = firstNumber(MINUTES_PATTERN, reason, 1);
    if (minutes != null) {
      return minutes;
    }
    final Integer hours = firstNumber(HOURS_PATTERN, reason, MINUTES_PER_HOUR);
    if (hours != null) {
      return hours;
    }
    return firstNumber(BACK_IN_PATTERN, reason, 1);
  }

  @VisibleForTesting
  Urgency detectUrgency(String reason) {
    if (reason == null) {
      return Urgency.NORMAL;
    }
    return containsAny(reason.toLowerCase(Locale.ROOT), CATEGORY_KEYWORDS.get(BreakReasonCategory.EMERGENCY))
        ? Urgency.URGENT
        : Urgency.NORMAL;
  }

  private Integer firstNumber(Pattern pattern, String text, int multiplier) {
    final Matcher matcher = pattern.matcher(text);
    if (!matcher.find()) {
      return null;
    }
    final long value;
    try {
      value = Math.multiplyExact(Long.parseLong(matcher.group(1)), multiplier);
    } catch (NumberFormatException | ArithmeticException ex) {
      // 桁あふれする数字列は上限超過と同じ扱い
      return null;
    }
    if (value < 0 || value > ClassifiedEvent.MAX_EXPECTED_DURATION_MINUTES) {
      return null;
    }
    return (int) value;
  }

  /** 休憩開始の照合パターンと、理由を名前付きグループ reason で取り出せるかどうか。 */
  private record BreakStartRule(Pattern pattern, boolean capturesReason) {

    static BreakStartRule withReason(String regex) {
      return new BreakStartRule(Pattern.compile(regex, FLAGS), true);
    }

    static BreakStartRule withoutReason(String regex) {
      return new BreakStartRule(Pattern.compile(regex, FLAGS), false);
    }

    String reason(Matcher matcher) {
      return capturesReason ? matcher.group("reason") : null;
    }
  }

  private boolean matchesAny(List<Pattern> patterns, String message) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(message).matches()) {
        return true;
      }
    }
    return false;
  }

  private boolean containsAny(String lower, List<String> keywords) {
    for (String keyword : keywords) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  private double confidenceWhen(boolean strongSignal) {
    return strongSignal ? HIGH_CONFIDENCE : DEFAULT_CONFIDENCE;
  }
}
