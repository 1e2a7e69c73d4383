/*
 * どこで: Common 共通設定のテスト
 * 何を: Clock がマイクロ秒単位に丸められることを検証する
 * なぜ: DB 往復後も Instant が一致する前提を守るため
 */
package com.campusevents.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimeConfigTest {

  @Test
  void clockTicksInMicroseconds() {
    final Clock clock = new TimeConfig().clock();

    final Instant now = Instant.now(clock);

    assertThat(now.getNano() % 1_000).isZero();
    assertThat(clock.getZone().getId()).isEqualTo("Z");
  }
}
