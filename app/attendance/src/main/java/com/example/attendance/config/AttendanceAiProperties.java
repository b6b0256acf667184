/*
 * どこで: Attendance 設定
 * 何を: AI 分類器 (OpenAI 互換 API) の接続設定を保持する
 * なぜ: 資格情報の有無で AI 分類の利用可否を決め、タイムアウトを環境で調整するため
 */
package com.example.attendance.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "attendance.ai")
public record AttendanceAiProperties(
    String baseUrl,
    String apiKey,
    String model,
    String completionsPath,
    Integer maxTokens,
    Duration connectTimeout,
    Duration readTimeout) {

  public AttendanceAiProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com" : baseUrl;
    apiKey = apiKey == null ? "" : apiKey;
    model = model == null || model.isBlank() ? "gpt-4o-mini" : model;
    completionsPath =
        completionsPath == null || completionsPath.isBlank()
            ? "/v1/chat/completions"
            : completionsPath;
    maxTokens = maxTokens == null || maxTokens <= 0 ? 256 : maxTokens;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(4) : readTimeout;
  }

  public boolean hasApiKey() {
    return !apiKey.isBlank();
  }
}
