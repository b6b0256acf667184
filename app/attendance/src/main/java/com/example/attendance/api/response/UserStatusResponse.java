package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserStatusResponse(
    String userId,
    String displayName,
    String status,
    Instant lastCheckinAt,
    Instant lastCheckoutAt,
    Instant lastBreakStartAt,
    String currentBreakReason,
    Instant expectedReturnAt,
    TodayStats todayStats) {}
