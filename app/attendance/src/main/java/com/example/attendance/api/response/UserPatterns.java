package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserPatterns(
    int totalCheckins,
    int totalCheckouts,
    int totalBreaks,
    String avgCheckinTime,
    String avgCheckoutTime,
    Double avgBreaksPerDay,
    Map<String, Double> breakReasonDistribution,
    Double avgBreakDurationMinutes,
    String lateCheckinThreshold,
    Integer longBreakThresholdMinutes) {}
