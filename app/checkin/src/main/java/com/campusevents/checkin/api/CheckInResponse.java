/*
 * どこで: Check-in API
 * 何を: スキャン判定結果のレスポンスを表す
 * なぜ: 受付端末が結果と理由をそのまま表示できるようにするため
 */
package com.campusevents.checkin.api;

import com.campusevents.checkin.service.CheckInResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckInResponse(
    String outcome,
    String reason,
    String message,
    UUID registrationId,
    String subjectId,
    String eventId,
    Instant checkedInAt,
    UUID recordId) {

  public static CheckInResponse from(CheckInResult result) {
    return new CheckInResponse(
        result.outcome().name(),
        result.reason() == null ? null : result.reason().name(),
        result.message(),
        result.registration() == null ? null : result.registration().registrationId(),
        result.registration() == null ? null : result.registration().subjectId(),
        result.registration() == null ? null : result.registration().eventId(),
        result.checkedInAt(),
        result.recordId());
  }
}
