/*
 * どこで: Attendance 設定
 * 何を: ステータス変更通知の publish 先 subject を保持する
 * なぜ: テナント単位の subject 体系を運用側で切り替えられるようにするため
 */
package com.example.attendance.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "attendance.status.nats")
@Validated
public record AttendanceStatusNatsProperties(@NotBlank String subjectPrefix) {

  public String subjectFor(String tenantId) {
    return subjectPrefix + "." + tenantId;
  }
}
