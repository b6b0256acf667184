/*
 * どこで: Attendance サービス層
 * 何を: 分類・記録・通知のアプリ固有メトリクス記録を集約する
 * なぜ: AI フォールバック率や重複取り込み、通知失敗を運用で継続監視できるようにするため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.ClassifierSource;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AttendanceMetrics {

  private static final String METRIC_CLASSIFICATION_TOTAL = "attendance.classification.total";
  private static final String METRIC_AI_FALLBACK_TOTAL = "attendance.classification.ai.fallback.total";
  private static final String METRIC_AI_LATENCY = "attendance.classification.ai.latency";
  private static final String METRIC_EVENT_RECORDED_TOTAL = "attendance.event.recorded.total";
  private static final String METRIC_EVENT_DUPLICATE_TOTAL = "attendance.event.duplicate.total";
  private static final String METRIC_PUBLISH_FAILURE_TOTAL = "attendance.status.publish.failure.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> classificationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> fallbackCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> recordedCounters = new ConcurrentHashMap<>();
  private final Counter duplicateCounter;
  private final Counter publishFailureCounter;
  private final Timer aiLatencyTimer;

  public AttendanceMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.duplicateCounter =
        Counter.builder(METRIC_EVENT_DUPLICATE_TOTAL)
            .description("Inbound messages skipped because the source message was already recorded")
            .register(meterRegistry);
    this.publishFailureCounter =
        Counter.builder(METRIC_PUBLISH_FAILURE_TOTAL)
            .description("Status change notifications that failed to publish")
            .register(meterRegistry);
    this.aiLatencyTimer =
        Timer.builder(METRIC_AI_LATENCY)
            .description("Latency of AI classification calls including timeouts")
            .register(meterRegistry);
  }

  public void recordClassification(ClassifierSource source, AttendanceEventKind kind) {
    final String key = source.value() + ":" + kind.value();
    classificationCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CLASSIFICATION_TOTAL)
                    .description("Classified inbound messages")
                    .tags(Tags.of("source", source.value(), "kind", kind.value()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAiFallback(String reason) {
    fallbackCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_AI_FALLBACK_TOTAL)
                    .description("Messages classified by rules because AI gave no result")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAiLatency(Duration latency) {
    if (latency == null || latency.isNegative()) {
      return;
    }
    aiLatencyTimer.record(latency);
  }

  public void recordEventRecorded(AttendanceEventKind kind) {
    recordedCounters
        .computeIfAbsent(
            kind.value(),
            ignored ->
                Counter.builder(METRIC_EVENT_RECORDED_TOTAL)
                    .description("Attendance events appended to the audit log")
                    .tags(Tags.of("kind", kind.value()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDuplicate() {
    duplicateCounter.increment();
  }

  public void recordPublishFailure() {
    publishFailureCounter.increment();
  }
}
