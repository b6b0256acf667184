/*
 * どこで: Attendance アプリのインフラ設定
 * 何を: NATS Connection を Spring 管理下に置く
 * なぜ: 投稿購読とステータス通知が同一接続を再利用するため
 */
package com.example.attendance.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(properties.connectionName())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .maxReconnects(properties.maxReconnects())
            // 切断/再接続は購読の停止・再開に直結するため運用ログへ残す
            .connectionListener(
                (connection, type) ->
                    logger.info(
                        "nats connection event type={} name={}", type, properties.connectionName()))
            .build();
    return Nats.connect(options);
  }
}
