package com.example.attendance.classifier.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatCompletionRequest(
    String model,
    Integer maxTokens,
    List<Message> messages,
    List<Tool> tools,
    Map<String, Object> toolChoice) {

  public record Message(String role, String content) {}

  public record Tool(String type, Function function) {}

  public record Function(String name, String description, Map<String, Object> parameters) {}
}
