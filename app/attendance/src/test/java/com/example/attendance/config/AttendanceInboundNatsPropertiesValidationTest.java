/*
 * どこで: Attendance 設定のバリデーションテスト
 * 何を: AttendanceInboundNatsProperties / AttendanceClassifierProperties の Bean Validation を検証する
 * なぜ: 起動時に不正な購読設定や分類待ち時間を検出できるようにするため
 */
package com.example.attendance.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttendanceInboundNatsPropertiesValidationTest {

  private static final String SUBJECT = "attendance.messages";
  private static final String STREAM = "ATTENDANCE_MESSAGES";
  private static final String DURABLE = "attendance-engine";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofSeconds(30);
  private static final int MAX_DELIVER = 5;

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    final AttendanceInboundNatsProperties properties =
        new AttendanceInboundNatsProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);

    assertTrue(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenAckWaitIsZero() {
    final AttendanceInboundNatsProperties properties =
        new AttendanceInboundNatsProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, Duration.ZERO, MAX_DELIVER);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenDuplicateWindowIsNegative() {
    final AttendanceInboundNatsProperties properties =
        new AttendanceInboundNatsProperties(
            SUBJECT, STREAM, DURABLE, Duration.ofSeconds(-1), ACK_WAIT, MAX_DELIVER);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenMaxDeliverIsZero() {
    final AttendanceInboundNatsProperties properties =
        new AttendanceInboundNatsProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 0);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void classifierValidationFailsWhenAiTimeoutIsZero() {
    final AttendanceClassifierProperties properties =
        new AttendanceClassifierProperties(true, Set.of(), Duration.ZERO, 4);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void classifierDisablesAiPerTenant() {
    final AttendanceClassifierProperties properties =
        new AttendanceClassifierProperties(true, Set.of("tenant-off"), Duration.ofSeconds(5), 4);

    assertTrue(validator.validate(properties).isEmpty());
    assertTrue(properties.isAiEnabledFor("tenant-on"));
    assertFalse(properties.isAiEnabledFor("tenant-off"));
  }
}
