/*
 * どこで: Check-in メトリクステスト
 * 何を: スキャン/登録操作のメトリクスが記録されることを検証する
 * なぜ: 重複率や台帳障害の監視指標が欠落する回帰を防ぐため
 */
package com.campusevents.checkin.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CheckInMetricsTest {

  @Test
  void recordsScanAndRegistrationMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CheckInMetrics metrics = new CheckInMetrics(registry);

    metrics.recordScan("ACCEPTED");
    metrics.recordScan("DUPLICATE");
    metrics.recordScan("DUPLICATE");
    metrics.recordScanDuration(Duration.ofMillis(12));
    metrics.recordScanDuration(Duration.ofMillis(-1));
    metrics.recordRegistration("ISSUE", "success");

    final Counter accepted =
        registry.get("checkin.scan.total").tag("outcome", "ACCEPTED").counter();
    final Counter duplicate =
        registry.get("checkin.scan.total").tag("outcome", "DUPLICATE").counter();
    final Counter issued =
        registry
            .get("checkin.registration.total")
            .tag("action", "ISSUE")
            .tag("result", "success")
            .counter();
    final Timer duration = registry.get("checkin.scan.duration").timer();

    assertThat(accepted.count()).isEqualTo(1.0d);
    assertThat(duplicate.count()).isEqualTo(2.0d);
    assertThat(issued.count()).isEqualTo(1.0d);
    assertThat(duration.count()).isEqualTo(1L);
  }
}
