/*
 * どこで: Attendance 分類層
 * 何を: AI 分類を優先し、使えない/失敗/時間切れの場合はルール分類にフォールバックする
 * なぜ: 外部 AI の障害や遅延があっても、1 投稿につき必ず 1 つの分類結果を返すため
 */
package com.example.attendance.classifier;

import com.example.attendance.config.AttendanceClassifierProperties;
import com.example.attendance.model.ClassifiedEvent;
import com.example.attendance.service.AttendanceMetrics;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class AttendanceClassifierOrchestrator {

  private static final Logger logger =
      LoggerFactory.getLogger(AttendanceClassifierOrchestrator.class);

  private final AiAttendanceClassifier aiClassifier;
  private final RuleBasedAttendanceClassifier ruleClassifier;
  private final AttendanceClassifierProperties properties;
  private final ExecutorService aiExecutor;
  private final AttendanceMetrics metrics;

  public AttendanceClassifierOrchestrator(
      AiAttendanceClassifier aiClassifier,
      RuleBasedAttendanceClassifier ruleClassifier,
      AttendanceClassifierProperties properties,
      @Qualifier("attendanceAiExecutor") ExecutorService aiExecutor,
      AttendanceMetrics metrics) {
    this.aiClassifier = aiClassifier;
    this.ruleClassifier = ruleClassifier;
    this.properties = properties;
    this.aiExecutor = aiExecutor;
    this.metrics = metrics;
  }

  public ClassifiedEvent classify(String tenantId, String text) {
    final ClassifiedEvent classified =
        tryAi(tenantId, text).orElseGet(() -> ruleClassifier.classifyOrNone(text));
    metrics.recordClassification(classified.source(), classified.kind());
    return classified;
  }

  private Optional<ClassifiedEvent> tryAi(String tenantId, String text) {
    if (!properties.isAiEnabledFor(tenantId)) {
      metrics.recordAiFallback("disabled");
      return Optional.empty();
    }
    if (!aiClassifier.isAvailable()) {
      metrics.recordAiFallback("unavailable");
      return Optional.empty();
    }

    final long startedAt = System.nanoTime();
    final Future<Optional<ClassifiedEvent>> future;
    try {
      future = aiExecutor.submit(() -> aiClassifier.classify(text));
    } catch (RejectedExecutionException ex) {
      // 停止処理中は executor が受け付けないのでルール分類で処理する
      logger.warn("ai classification rejected by executor tenantId={}", tenantId);
      metrics.recordAiFallback("rejected");
      return Optional.empty();
    }

    try {
      final Duration timeout = properties.aiTimeout();
      final Optional<ClassifiedEvent> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result.isEmpty()) {
        metrics.recordAiFallback("no_result");
      }
      return result;
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.warn(
          "ai classification timed out tenantId={} timeoutMs={}",
          tenantId,
          properties.aiTimeout().toMillis());
      metrics.recordAiFallback("timeout");
      return Optional.empty();
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      logger.warn("ai classification interrupted tenantId={}", tenantId);
      metrics.recordAiFallback("interrupted");
      return Optional.empty();
    } catch (ExecutionException ex) {
      logger.warn("ai classification failed tenantId={}", tenantId, ex.getCause());
      metrics.recordAiFallback("failed");
      return Optional.empty();
    } finally {
      metrics.recordAiLatency(Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }
}
