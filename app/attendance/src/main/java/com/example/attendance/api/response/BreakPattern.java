package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BreakPattern(
    List<PeakHour> peakHours,
    String averageTime,
    Map<String, Long> hourDistribution,
    List<ReasonCount> reasons,
    List<LongBreak> longBreaks) {}
