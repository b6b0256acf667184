/*
 * Where: Attendance service layer
 * What: Clears the per-day counters on every status row
 * Why: today_* fields describe the current day only and must start from zero each morning
 */
package com.example.attendance.service;

import com.example.attendance.repository.UserAttendanceStatusRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AttendanceDailyResetService {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceDailyResetService.class);

  private final UserAttendanceStatusRepository statusRepository;
  private final Clock clock;

  @Transactional
  public int resetDailyCounters() {
    final Instant now = Instant.now(clock);
    final int updated = statusRepository.resetDailyCounters(now);
    logger.info("attendance daily counters reset rows={} at={}", updated, now);
    return updated;
  }
}
