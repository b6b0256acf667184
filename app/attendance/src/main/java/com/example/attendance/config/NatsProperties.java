/*
 * どこで: Attendance 設定
 * 何を: NATS 接続設定 (接続先・タイムアウト・接続名・再接続回数) を保持する
 * なぜ: 取り込み/通知の有効/無効や接続先を環境で切り替え、サーバー側で接続元を識別できるようにするため
 */
package com.example.attendance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled,
    String url,
    Integer connectionTimeout,
    String connectionName,
    Integer maxReconnects) {

  private static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 5;
  private static final String DEFAULT_CONNECTION_NAME = "attendance";
  // -1 は jnats で無制限の再接続を意味する
  private static final int UNLIMITED_RECONNECTS = -1;

  public NatsProperties {
    if (connectionTimeout == null) {
      connectionTimeout = DEFAULT_CONNECTION_TIMEOUT_SECONDS;
    }
    if (connectionName == null || connectionName.isBlank()) {
      connectionName = DEFAULT_CONNECTION_NAME;
    }
    if (maxReconnects == null) {
      maxReconnects = UNLIMITED_RECONNECTS;
    }
  }
}
