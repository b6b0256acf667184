package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceEventResponse(
    String eventId,
    String eventType,
    Instant eventTime,
    String reason,
    String reasonCategory,
    Integer actualDurationMinutes,
    double confidence,
    String source) {}
