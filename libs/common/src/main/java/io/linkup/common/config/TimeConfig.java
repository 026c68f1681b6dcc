/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として提供する
 */
package io.linkup.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
