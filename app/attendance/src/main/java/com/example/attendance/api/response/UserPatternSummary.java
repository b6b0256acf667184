package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserPatternSummary(
    String userId, int periodDays, UserPatterns patterns, String message) {

  public static UserPatternSummary notEnoughData(String userId, int periodDays) {
    return new UserPatternSummary(
        userId, periodDays, null, "Not enough data to compute patterns");
  }
}
