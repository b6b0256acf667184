/*
 * どこで: Attendance 設定
 * 何を: 分類オーケストレーションの設定 (AI 利用可否/テナント除外/待ち時間) を保持する
 * なぜ: テナントごとに AI 分類を止められるようにし、取り込み経路の待ち時間に上限を設けるため
 */
package com.example.attendance.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "attendance.classifier")
@Validated
public record AttendanceClassifierProperties(
    boolean aiEnabled,
    Set<String> aiDisabledTenants,
    @NotNull Duration aiTimeout,
    @NotNull @Positive Integer aiPoolSize) {

  public AttendanceClassifierProperties {
    aiDisabledTenants = aiDisabledTenants == null ? Set.of() : Set.copyOf(aiDisabledTenants);
  }

  @AssertTrue(message = "attendance.classifier.ai-timeout must be positive")
  public boolean isAiTimeoutPositive() {
    return aiTimeout != null && !aiTimeout.isZero() && !aiTimeout.isNegative();
  }

  public boolean isAiEnabledFor(String tenantId) {
    return aiEnabled && !aiDisabledTenants.contains(tenantId);
  }
}
