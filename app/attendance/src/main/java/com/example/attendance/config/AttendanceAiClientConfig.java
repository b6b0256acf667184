package com.example.attendance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class AttendanceAiClientConfig {

  @Bean
  RestClient attendanceAiRestClient(RestClient.Builder builder, AttendanceAiProperties properties) {
    // AI 分類専用 RestClient。取り込みを止めないよう接続/読み取りの両方に上限を設ける。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
