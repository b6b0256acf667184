package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.ClassifierSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AttendanceMetricsTest {

  @Test
  void recordsClassificationAndIngestCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final AttendanceMetrics metrics = new AttendanceMetrics(registry);

    metrics.recordClassification(ClassifierSource.AI, AttendanceEventKind.CHECK_IN);
    metrics.recordClassification(ClassifierSource.AI, AttendanceEventKind.CHECK_IN);
    metrics.recordClassification(ClassifierSource.RULE, AttendanceEventKind.NONE);
    metrics.recordAiFallback("timeout");
    metrics.recordEventRecorded(AttendanceEventKind.BREAK_END);
    metrics.recordDuplicate();
    metrics.recordPublishFailure();
    metrics.recordAiLatency(Duration.ofMillis(120));

    final double aiCheckins =
        registry
            .get("attendance.classification.total")
            .tag("source", "ai")
            .tag("kind", "checkin")
            .counter()
            .count();
    final double ruleNone =
        registry
            .get("attendance.classification.total")
            .tag("source", "rule")
            .tag("kind", "none")
            .counter()
            .count();
    final double timeouts =
        registry
            .get("attendance.classification.ai.fallback.total")
            .tag("reason", "timeout")
            .counter()
            .count();
    final double recorded =
        registry.get("attendance.event.recorded.total").tag("kind", "break_end").counter().count();

    assertThat(aiCheckins).isEqualTo(2.0);
    assertThat(ruleNone).isEqualTo(1.0);
    assertThat(timeouts).isEqualTo(1.0);
    assertThat(recorded).isEqualTo(1.0);
    assertThat(registry.get("attendance.event.duplicate.total").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("attendance.status.publish.failure.total").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("attendance.classification.ai.latency").timer().count()).isEqualTo(1L);
  }

  @Test
  void ignoresNegativeOrMissingLatency() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final AttendanceMetrics metrics = new AttendanceMetrics(registry);

    metrics.recordAiLatency(Duration.ofMillis(-1));
    metrics.recordAiLatency(null);

    assertThat(registry.get("attendance.classification.ai.latency").timer().count()).isZero();
  }
}
