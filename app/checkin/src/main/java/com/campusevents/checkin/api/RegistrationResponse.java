/*
 * どこで: Check-in API
 * 何を: 登録の状態を返すレスポンスを表す
 * なぜ: 発行時だけ artifact を含め、参照時は秘密情報を出さないため
 */
package com.campusevents.checkin.api;

import com.campusevents.checkin.model.RegistrationRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegistrationResponse(
    UUID registrationId,
    String subjectId,
    String eventId,
    String state,
    Instant createdAt,
    Instant checkedInAt,
    Instant voidedAt,
    Instant checkInClosesAt,
    String artifact) {

  public static RegistrationResponse from(RegistrationRecord record) {
    return from(record, null);
  }

  public static RegistrationResponse from(RegistrationRecord record, String artifact) {
    return new RegistrationResponse(
        record.registrationId(),
        record.subjectId(),
        record.eventId(),
        record.state().name(),
        record.createdAt(),
        record.checkedInAt(),
        record.voidedAt(),
        record.checkInClosesAt(),
        artifact);
  }
}
