/*
 * どこで: Attendance API
 * 何を: 投稿取り込みと、現在状態・履歴・パターン分析・集計の参照エンドポイントを公開する
 * なぜ: レポート/ダッシュボード層が勤怠データを読み出す入口を提供するため
 */
package com.example.attendance.api;

import com.example.attendance.api.request.IngestAttendanceMessageRequest;
import com.example.attendance.api.response.AttendanceEventResponse;
import com.example.attendance.api.response.AttendanceSummaryResponse;
import com.example.attendance.api.response.IngestAttendanceMessageResponse;
import com.example.attendance.api.response.RebuildStatusResponse;
import com.example.attendance.api.response.TeamPatternSummary;
import com.example.attendance.api.response.TeamStatusResponse;
import com.example.attendance.api.response.UserPatternSummary;
import com.example.attendance.model.InboundAttendanceMessage;
import com.example.attendance.service.AttendanceQueryService;
import com.example.attendance.service.AttendanceService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tenants/{tenantId}/attendance")
@RequiredArgsConstructor
public class AttendanceController {

  private static final String HEADER_TRACE_ID = "X-Trace-Id";

  private final AttendanceService attendanceService;
  private final AttendanceQueryService queryService;

  @PostMapping("/messages")
  public ResponseEntity<IngestAttendanceMessageResponse> ingestMessage(
      @PathVariable("tenantId") String tenantId,
      @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
      @Valid @RequestBody IngestAttendanceMessageRequest request) {
    final InboundAttendanceMessage message =
        new InboundAttendanceMessage(
            tenantId,
            request.authorId(),
            request.channelId(),
            request.messageId(),
            request.content(),
            request.authoredAt());
    final IngestAttendanceMessageResponse response =
        attendanceService
            .processMessage(message, traceId)
            .map(event -> new IngestAttendanceMessageResponse(true, queryService.toEventResponse(event)))
            .orElseGet(() -> new IngestAttendanceMessageResponse(false, null));
    return ResponseEntity.ok(response);
  }

  @GetMapping("/status")
  public ResponseEntity<TeamStatusResponse> getTeamStatus(
      @PathVariable("tenantId") String tenantId) {
    return ResponseEntity.ok(queryService.getTeamStatus(tenantId));
  }

  @GetMapping("/users/{userId}/history")
  public ResponseEntity<List<AttendanceEventResponse>> getUserHistory(
      @PathVariable("tenantId") String tenantId,
      @PathVariable("userId") String userId,
      @RequestParam(value = "days", defaultValue = "7") int days) {
    return ResponseEntity.ok(queryService.getUserHistory(tenantId, userId, days));
  }

  @GetMapping("/users/{userId}/patterns")
  public ResponseEntity<UserPatternSummary> getUserPatterns(
      @PathVariable("tenantId") String tenantId,
      @PathVariable("userId") String userId,
      @RequestParam(value = "days", defaultValue = "30") int days) {
    return ResponseEntity.ok(queryService.getUserPatterns(tenantId, userId, days));
  }

  @PostMapping("/users/{userId}/status/rebuild")
  public ResponseEntity<RebuildStatusResponse> rebuildStatus(
      @PathVariable("tenantId") String tenantId, @PathVariable("userId") String userId) {
    return ResponseEntity.ok(
        new RebuildStatusResponse(
            tenantId,
            queryService.describeStatus(attendanceService.rebuildStatus(tenantId, userId))));
  }

  @GetMapping("/summary")
  public ResponseEntity<AttendanceSummaryResponse> getSummary(
      @PathVariable("tenantId") String tenantId,
      @RequestParam(value = "days", defaultValue = "7") int days) {
    return ResponseEntity.ok(queryService.getSummary(tenantId, days));
  }

  @GetMapping("/insights")
  public ResponseEntity<TeamPatternSummary> getInsights(
      @PathVariable("tenantId") String tenantId,
      @RequestParam(value = "days", defaultValue = "30") int days) {
    return ResponseEntity.ok(queryService.getInsights(tenantId, days));
  }
}
