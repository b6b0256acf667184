/*
 * どこで: Attendance アプリの起動テスト
 * 何を: Spring コンテキストの起動を確認する
 * なぜ: 基本の構成が壊れていないことを保証するため
 */
package com.example.attendance;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.attendance.service.AttendanceStatusPublisher;
import com.example.attendance.service.NoopAttendanceStatusPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AttendanceApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private AttendanceStatusPublisher statusPublisher;

  @Test
  void contextLoads() {
    // nats.enabled=false では通知は Noop 実装になる
    assertThat(statusPublisher).isInstanceOf(NoopAttendanceStatusPublisher.class);
  }
}
