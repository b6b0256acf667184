/*
 * どこで: AttendanceClassifierOrchestrator の単体テスト
 * 何を: AI 優先とルール分類へのフォールバック、フォールバック理由のメトリクスを検証する
 * なぜ: AI の停止/遅延/失敗のどの場合でも 1 投稿に 1 つの分類結果が返ることを保証するため
 */
package com.example.attendance.classifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.attendance.config.AttendanceClassifierProperties;
import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.ClassifiedEvent;
import com.example.attendance.model.ClassifierSource;
import com.example.attendance.service.AttendanceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttendanceClassifierOrchestratorTest {

  private static final String TENANT = "tenant-1";

  private final RuleBasedAttendanceClassifier ruleClassifier = new RuleBasedAttendanceClassifier();
  private AiAttendanceClassifier aiClassifier;
  private SimpleMeterRegistry registry;
  private AttendanceMetrics metrics;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    aiClassifier = mock(AiAttendanceClassifier.class);
    registry = new SimpleMeterRegistry();
    metrics = new AttendanceMetrics(registry);
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void usesAiResultWhenAvailable() {
    final ClassifiedEvent aiEvent =
        ClassifiedEvent.of(AttendanceEventKind.CHECK_IN, 0.9, ClassifierSource.AI);
    when(aiClassifier.isAvailable()).thenReturn(true);
    when(aiClassifier.classify("morning folks")).thenReturn(Optional.of(aiEvent));

    final ClassifiedEvent result = orchestrator(Set.of(), Duration.ofSeconds(1)).classify(TENANT, "morning folks");

    assertThat(result).isEqualTo(aiEvent);
    assertThat(classificationCount("ai", "checkin")).isEqualTo(1.0);
    assertThat(registry.get("attendance.classification.ai.latency").timer().count()).isEqualTo(1L);
  }

  @Test
  void fallsBackToRulesWhenTenantIsExcluded() {
    final ClassifiedEvent result =
        orchestrator(Set.of(TENANT), Duration.ofSeconds(1)).classify(TENANT, "back");

    assertThat(result.kind()).isEqualTo(AttendanceEventKind.BREAK_END);
    assertThat(result.source()).isEqualTo(ClassifierSource.RULE);
    assertThat(fallbackCount("disabled")).isEqualTo(1.0);
    verify(aiClassifier, never()).classify(anyString());
  }

  @Test
  void fallsBackToRulesWhenAiDisabledGlobally() {
    final AttendanceClassifierOrchestrator orchestrator =
        new AttendanceClassifierOrchestrator(
            aiClassifier,
            ruleClassifier,
            new AttendanceClassifierProperties(false, Set.of(), Duration.ofSeconds(1), 1),
            executor,
            metrics);

    assertThat(orchestrator.classify(TENANT, "eod").source()).isEqualTo(ClassifierSource.RULE);
    assertThat(fallbackCount("disabled")).isEqualTo(1.0);
  }

  @Test
  void fallsBackToRulesWhenAiIsUnavailable() {
    when(aiClassifier.isAvailable()).thenReturn(false);

    final ClassifiedEvent result = orchestrator(Set.of(), Duration.ofSeconds(1)).classify(TENANT, "lunch");

    assertThat(result.kind()).isEqualTo(AttendanceEventKind.BREAK_START);
    assertThat(result.source()).isEqualTo(ClassifierSource.RULE);
    assertThat(fallbackCount("unavailable")).isEqualTo(1.0);
  }

  @Test
  void fallsBackToRulesWhenAiReturnsNothing() {
    when(aiClassifier.isAvailable()).thenReturn(true);
    when(aiClassifier.classify("gm")).thenReturn(Optional.empty());

    final ClassifiedEvent result = orchestrator(Set.of(), Duration.ofSeconds(1)).classify(TENANT, "gm");

    assertThat(result.kind()).isEqualTo(AttendanceEventKind.CHECK_IN);
    assertThat(result.source()).isEqualTo(ClassifierSource.RULE);
    assertThat(fallbackCount("no_result")).isEqualTo(1.0);
  }

  @Test
  void fallsBackToRulesWhenAiThrows() {
    when(aiClassifier.isAvailable()).thenReturn(true);
    when(aiClassifier.classify("gm")).thenThrow(new IllegalStateException("boom"));

    final ClassifiedEvent result = orchestrator(Set.of(), Duration.ofSeconds(1)).classify(TENANT, "gm");

    assertThat(result.source()).isEqualTo(ClassifierSource.RULE);
    assertThat(fallbackCount("failed")).isEqualTo(1.0);
  }

  @Test
  void fallsBackToRulesWhenAiTimesOut() throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    when(aiClassifier.isAvailable()).thenReturn(true);
    when(aiClassifier.classify("brb"))
        .thenAnswer(
            invocation -> {
              release.await(5, TimeUnit.SECONDS);
              return Optional.of(
                  ClassifiedEvent.of(AttendanceEventKind.CHECK_OUT, 0.9, ClassifierSource.AI));
            });

    final ClassifiedEvent result = orchestrator(Set.of(), Duration.ofMillis(50)).classify(TENANT, "brb");
    release.countDown();

    assertThat(result.kind()).isEqualTo(AttendanceEventKind.BREAK_START);
    assertThat(result.source()).isEqualTo(ClassifierSource.RULE);
    assertThat(fallbackCount("timeout")).isEqualTo(1.0);
  }

  @Test
  void fallsBackToRulesWhenExecutorRejects() {
    when(aiClassifier.isAvailable()).thenReturn(true);
    executor.shutdown();

    final ClassifiedEvent result = orchestrator(Set.of(), Duration.ofSeconds(1)).classify(TENANT, "out");

    assertThat(result.kind()).isEqualTo(AttendanceEventKind.CHECK_OUT);
    assertThat(fallbackCount("rejected")).isEqualTo(1.0);
  }

  @Test
  void noneResultIsCountedAsClassification() {
    when(aiClassifier.isAvailable()).thenReturn(false);

    final ClassifiedEvent result =
        orchestrator(Set.of(), Duration.ofSeconds(1)).classify(TENANT, "lgtm, merging now");

    assertThat(result.isNone()).isTrue();
    assertThat(classificationCount("rule", "none")).isEqualTo(1.0);
  }

  private AttendanceClassifierOrchestrator orchestrator(Set<String> disabledTenants, Duration timeout) {
    return new AttendanceClassifierOrchestrator(
        aiClassifier,
        ruleClassifier,
        new AttendanceClassifierProperties(true, disabledTenants, timeout, 1),
        executor,
        metrics);
  }

  private double fallbackCount(String reason) {
    return registry
        .get("attendance.classification.ai.fallback.total")
        .tag("reason", reason)
        .counter()
        .count();
  }

  private double classificationCount(String source, String kind) {
    return registry
        .get("attendance.classification.total")
        .tag("source", source)
        .tag("kind", kind)
        .counter()
        .count();
  }
}
