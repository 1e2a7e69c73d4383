/*
 * どこで: Check-in ドメインモデル
 * 何を: registration_audit の登録用データを表す
 * なぜ: 発行・無効化など管理操作の履歴を状態行とは独立に残すため
 */
package com.campusevents.checkin.model;

import java.time.Instant;
import java.util.UUID;

public record RegistrationAuditRecord(
    UUID auditId,
    Instant occurredAt,
    UUID registrationId,
    String action,
    String actorId,
    String reason,
    String requestId,
    String detailJson) {}
