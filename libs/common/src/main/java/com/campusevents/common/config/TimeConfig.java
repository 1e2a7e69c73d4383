/*
 * どこで: Common 共通設定
 * 何を: マイクロ秒刻みの Clock を DI 可能にする
 * なぜ: PostgreSQL timestamptz の精度と一致させ、保存値から監査ハッシュを再計算できるようにするため
 */
package com.campusevents.common.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  static final Duration DATABASE_PRECISION = Duration.ofNanos(1_000);

  @Bean
  public Clock clock() {
    return Clock.tick(Clock.systemUTC(), DATABASE_PRECISION);
  }
}
