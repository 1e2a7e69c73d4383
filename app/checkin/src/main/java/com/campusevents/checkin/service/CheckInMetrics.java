/*
 * どこで: Check-in サービス層
 * 何を: スキャン結果と登録操作のメトリクス記録を集約する
 * なぜ: 重複スキャン率や台帳障害を運用で継続監視できるようにするため
 */
package com.campusevents.checkin.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class CheckInMetrics {

  static final String METRIC_SCAN_TOTAL = "checkin.scan.total";
  static final String METRIC_SCAN_DURATION = "checkin.scan.duration";
  static final String METRIC_REGISTRATION_TOTAL = "checkin.registration.total";
  static final String OUTCOME_STORAGE_UNAVAILABLE = "STORAGE_UNAVAILABLE";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> scanCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> registrationCounters = new ConcurrentHashMap<>();
  private final Timer scanDurationTimer;

  public CheckInMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.scanDurationTimer =
        Timer.builder(METRIC_SCAN_DURATION)
            .description("Check-in scan processing time including the ledger transaction")
            .register(meterRegistry);
  }

  public void recordScan(String outcome) {
    scanCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_SCAN_TOTAL)
                    .description("Check-in scan attempts by outcome")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordScanDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    scanDurationTimer.record(duration);
  }

  public void recordRegistration(String action, String result) {
    final String key = action + ":" + result;
    registrationCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_REGISTRATION_TOTAL)
                    .description("Registration ledger commands")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }
}
