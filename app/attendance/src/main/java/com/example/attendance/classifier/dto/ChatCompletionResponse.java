package com.example.attendance.classifier.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatCompletionResponse(List<Choice> choices) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Choice(Message message) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Message(String content, List<ToolCall> toolCalls) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ToolCall(String id, String type, FunctionCall function) {}

  // arguments は JSON 文字列のまま返るため、呼び出し側で再度デコードする
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record FunctionCall(String name, String arguments) {}
}
