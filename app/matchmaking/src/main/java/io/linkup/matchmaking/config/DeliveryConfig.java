/*
 * どこで: Matchmaking インフラ設定
 * 何を: イベント配信専用の executor を提供する
 * なぜ: 配信 IO を sweep/リクエストスレッドから切り離すため
 */
package io.linkup.matchmaking.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DeliveryConfig {

  public static final String DELIVERY_EXECUTOR = "deliveryExecutor";

  @Bean(name = DELIVERY_EXECUTOR)
  public ThreadPoolTaskExecutor deliveryExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("mm-delivery-");
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(10_000);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    // 送信スレッドへ呼び出し元の MDC (trace_id 等) を引き継ぐ
    executor.setTaskDecorator(
        task -> {
          final Map<String, String> context = MDC.getCopyOfContextMap();
          return () -> {
            if (context != null) {
              MDC.setContextMap(context);
            }
            try {
              task.run();
            } finally {
              MDC.clear();
            }
          };
        });
    return executor;
  }
}
