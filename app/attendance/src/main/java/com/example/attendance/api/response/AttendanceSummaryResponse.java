package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceSummaryResponse(
    int periodDays, Map<String, Long> eventCounts, long uniqueUsers, long totalEvents) {}
