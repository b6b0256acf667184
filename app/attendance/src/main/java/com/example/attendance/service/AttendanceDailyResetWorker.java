/*
 * Where: Attendance daily reset worker
 * What: Triggers the daily counter reset on a cron schedule
 * Why: Automate the day boundary without an external scheduler
 */
package com.example.attendance.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "attendance.daily-reset.enabled", havingValue = "true")
public class AttendanceDailyResetWorker {

  private final AttendanceDailyResetService dailyResetService;

  @Scheduled(
      cron = "${attendance.daily-reset.cron}",
      zone = "${attendance.daily-reset.zone}")
  public void run() {
    dailyResetService.resetDailyCounters();
  }
}
