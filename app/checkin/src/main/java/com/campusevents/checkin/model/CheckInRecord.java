/*
 * どこで: Check-in ドメインモデル
 * 何を: check_in_records の追記専用エントリを表す
 * なぜ: 成功・失敗を問わず全スキャンの証跡を保持するため
 */
package com.campusevents.checkin.model;

import java.time.Instant;
import java.util.UUID;

public record CheckInRecord(
    UUID recordId,
    long recordSeq,
    UUID registrationId,
    CheckInOutcome outcome,
    CheckInReason reason,
    String deviceId,
    String artifactDigest,
    Instant occurredAt,
    String prevHash,
    String recordHash) {}
