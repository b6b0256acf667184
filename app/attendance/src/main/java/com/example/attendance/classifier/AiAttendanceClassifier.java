/*
 * どこで: Attendance 分類層
 * 何を: 外部の Chat Completion API に投稿を送り、構造化された勤怠分類を受け取る
 * なぜ: 定型フレーズに乗らない投稿も分類し、失敗時は空を返してルール分類へ任せるため
 */
package com.example.attendance.classifier;

import com.example.attendance.classifier.dto.AiAttendanceArguments;
import com.example.attendance.classifier.dto.ChatCompletionRequest;
import com.example.attendance.classifier.dto.ChatCompletionResponse;
import com.example.attendance.config.AttendanceAiProperties;
import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.BreakReasonCategory;
import com.example.attendance.model.ClassifiedEvent;
import com.example.attendance.model.ClassifierSource;
import com.example.attendance.model.Urgency;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class AiAttendanceClassifier implements AttendanceClassifier {

  private static final Logger logger = LoggerFactory.getLogger(AiAttendanceClassifier.class);

  static final String TOOL_NAME = "record_attendance";
  private static final double DEFAULT_CONFIDENCE = 0.8;

  private static final String SYSTEM_PROMPT =
      """
      You are an attendance tracking assistant that analyzes messages from a team check-in channel.

      Your job is to detect attendance events from messages. Team members post status updates in various formats:

      Check-in (starting work):
      - "✅ Available" or just "Available"
      - "Good morning", "GM", "Online", "In"
      - Any message indicating they're starting work or are now available

      Check-out (ending work):
      - "👋 Signing Out" or "Signing Out"
      - "EOD", "End of day", "Logging off", "Done for the day"
      - "Good night", "GN", "Bye", "Leaving"

      Break start (temporarily away):
      - "BRB", "BRB - reason", "AFK", "Taking a break", "Lunch", "Stepping out"
      - Look for reasons (lunch, errand, rest, meeting, etc.)
      - Look for duration hints ("30 mins", "1 hour", "back in 15")

      Break end (returning from break):
      - "Back", "I'm back", "Here", "Returned"

      Not an attendance event:
      - General chat, questions, work updates
      - Messages that don't indicate status changes

      Be flexible with emoji usage, typos, abbreviations and natural language variations.
      """;

  private static final Map<String, Object> TOOL_PARAMETERS =
      Map.of(
          "type", "object",
          "properties",
              Map.of(
                  "event_type",
                  Map.of(
                      "type", "string",
                      "enum", List.of("checkin", "checkout", "break_start", "break_end", "none"),
                      "description", "The type of attendance event detected"),
                  "confidence",
                  Map.of(
                      "type", "number",
                      "minimum", 0,
                      "maximum", 1,
                      "description", "Confidence score from 0 to 1"),
                  "reason",
                  Map.of("type", "string", "description", "For breaks, the reason given (if any)"),
                  "reason_category",
                  Map.of(
                      "type", "string",
                      "enum", List.of("meal", "personal", "rest", "meeting", "emergency", "other"),
                      "description", "Category of the break reason"),
                  "expected_duration_minutes",
                  Map.of("type", "integer", "description", "Expected duration in minutes (if mentioned)"),
                  "urgency",
                  Map.of(
                      "type", "string",
                      "enum", List.of("normal", "urgent"),
                      "description", "Whether this seems urgent/emergency")),
          "required", List.of("event_type", "confidence"));

  private final RestClient attendanceAiRestClient;
  private final AttendanceAiProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public boolean isAvailable() {
    return properties.hasApiKey();
  }

  @Override
  public Optional<ClassifiedEvent> classify(String text) {
    if (!isAvailable()) {
      return Optional.empty();
    }
    final String message = text == null ? "" : text.strip();
    if (message.isEmpty()) {
      return Optional.of(ClassifiedEvent.none(ClassifierSource.AI));
    }
    return callCompletion(message).flatMap(this::extractArguments).flatMap(this::toClassifiedEvent);
  }

  private Optional<ChatCompletionResponse> callCompletion(String message) {
    try {
      final ChatCompletionResponse response =
          attendanceAiRestClient
              .post()
              .uri(properties.completionsPath())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
              .body(toRequest(message))
              .retrieve()
              .body(ChatCompletionResponse.class);
      if (response == null) {
        logger.warn("ai classification returned empty body");
      }
      return Optional.ofNullable(response);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "ai classification failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      return Optional.empty();
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("ai classification timed out");
      } else {
        logger.warn("ai classification connection failed", ex);
      }
      return Optional.empty();
    } catch (RuntimeException ex) {
      logger.warn("ai classification response parse failed", ex);
      return Optional.empty();
    }
  }

  private ChatCompletionRequest toRequest(String message) {
    return new ChatCompletionRequest(
        properties.model(),
        properties.maxTokens(),
        List.of(
            new ChatCompletionRequest.Message("system", SYSTEM_PROMPT),
            new ChatCompletionRequest.Message(
                "user", "Analyze this attendance message:\n\n" + message)),
        List.of(
            new ChatCompletionRequest.Tool(
                "function",
                new ChatCompletionRequest.Function(
                    TOOL_NAME, "Record an attendance event detected from a message", TOOL_PARAMETERS))),
        Map.of("type", "function", "function", Map.of("name", TOOL_NAME)));
  }

  private Optional<AiAttendanceArguments> extractArguments(ChatCompletionResponse response) {
    if (response.choices() == null || response.choices().isEmpty()) {
      logger.warn("ai classification response has no choices");
      return Optional.empty();
    }
    final ChatCompletionResponse.Message message = response.choices().get(0).message();
    if (message == null || message.toolCalls() == null || message.toolCalls().isEmpty()) {
      logger.warn("ai classification response has no tool call");
      return Optional.empty();
    }
    final ChatCompletionResponse.FunctionCall function = message.toolCalls().get(0).function();
    if (function == null || !TOOL_NAME.equals(function.name()) || function.arguments() == null) {
      logger.warn("ai classification response has unexpected tool call");
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(function.arguments(), AiAttendanceArguments.class));
    } catch (JsonProcessingException ex) {
      logger.warn("ai classification arguments parse failed: {}", ex.getOriginalMessage());
      return Optional.empty();
    }
  }

  /**
   * 役割: ツール引数を ClassifiedEvent へ正規化する。
   * 動作: 未知の event_type は結果なし、confidence は既定 0.8 で [0,1] に丸め、範囲外の予定時間は捨てる。
   */
  private Optional<ClassifiedEvent> toClassifiedEvent(AiAttendanceArguments arguments) {
    final AttendanceEventKind kind;
    try {
      kind = AttendanceEventKind.fromValue(arguments.eventType());
    } catch (IllegalArgumentException ex) {
      logger.warn("ai classification returned unknown event_type={}", arguments.eventType());
      return Optional.empty();
    }
    final double confidence =
        arguments.confidence() == null
            ? DEFAULT_CONFIDENCE
            : Math.max(0.0, Math.min(1.0, arguments.confidence()));
    final String reason =
        arguments.reason() == null || arguments.reason().isBlank() ? null : arguments.reason().strip();
    final BreakReasonCategory category =
        arguments.reasonCategory() == null || arguments.reasonCategory().isBlank()
            ? null
            : BreakReasonCategory.findByValue(arguments.reasonCategory())
                .orElse(BreakReasonCategory.OTHER);
    final Integer duration = arguments.expectedDurationMinutes();
    final Integer expectedDuration =
        duration != null && duration >= 1 && duration <= ClassifiedEvent.MAX_EXPECTED_DURATION_MINUTES
            ? duration
            : null;
    return Optional.of(
        new ClassifiedEvent(
            kind,
            confidence,
            reason,
            category,
            expectedDuration,
            Urgency.fromValueOrNormal(arguments.urgency()),
            ClassifierSource.AI));
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
