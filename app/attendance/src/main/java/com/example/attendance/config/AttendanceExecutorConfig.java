/*
 * どこで: Attendance アプリのインフラ設定
 * 何を: AI 分類とステータス通知のスレッドプールを提供する
 * なぜ: 外部呼び出しを取り込みスレッドから切り離し、終了時に中断できるようにするため
 */
package com.example.attendance.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class AttendanceExecutorConfig {

  private static final int PUBLISH_POOL_SIZE = 2;

  // 停止時は shutdownNow で実行中の AI 呼び出しを中断し、呼び出し側はルール分類へフォールバックする
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService attendanceAiExecutor(AttendanceClassifierProperties properties) {
    return Executors.newFixedThreadPool(
        properties.aiPoolSize(), new CustomizableThreadFactory("attendance-ai-"));
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService attendancePublishExecutor() {
    return Executors.newFixedThreadPool(
        PUBLISH_POOL_SIZE, new CustomizableThreadFactory("attendance-publish-"));
  }
}
