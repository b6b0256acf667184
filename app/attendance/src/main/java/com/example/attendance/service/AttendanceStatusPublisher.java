package com.example.attendance.service;

import com.example.common.event.AttendanceStatusChangedPayload;

/** ステータス変更をリアルタイム購読者へ配信する。配信の成否は記録処理に影響しない。 */
public interface AttendanceStatusPublisher {

  void publish(String tenantId, AttendanceStatusChangedPayload payload);
}
