/*
 * どこで: Attendance サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカルテストで NATS なしでも Service を起動可能にするため
 */
package com.example.attendance.service;

import com.example.common.event.AttendanceStatusChangedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopAttendanceStatusPublisher implements AttendanceStatusPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopAttendanceStatusPublisher.class);

  @Override
  public void publish(String tenantId, AttendanceStatusChangedPayload payload) {
    logger.debug(
        "nats disabled, skip status publish tenantId={} userId={}", tenantId, payload.userId());
  }
}
