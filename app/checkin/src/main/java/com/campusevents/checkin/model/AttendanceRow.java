/*
 * どこで: Check-in ドメインモデル
 * 何を: 出席レポート 1 行分の正規形を表す
 * なぜ: 全エンコーダが同じ順序・同じ値を出力できるようにするため
 */
package com.campusevents.checkin.model;

import java.time.Instant;
import java.util.UUID;

public record AttendanceRow(
    UUID registrationId,
    String subjectId,
    RegistrationState state,
    Instant registeredAt,
    Instant checkedInAt,
    String checkedInDevice) {}
