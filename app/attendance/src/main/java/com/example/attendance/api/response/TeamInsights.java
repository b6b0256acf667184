package com.example.attendance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TeamInsights(
    List<MemberAverageTime> earlyBirds,
    List<MemberAverageTime> nightOwls,
    List<MemberBreakCount> mostBreaks) {}
