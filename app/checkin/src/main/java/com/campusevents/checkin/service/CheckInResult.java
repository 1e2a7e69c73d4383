/*
 * どこで: Check-in サービス層
 * 何を: スキャン 1 回の判定結果を表す
 * なぜ: 拒否も例外ではなく値として返し、同一トランザクションの監査追記を巻き戻さないため
 */
package com.campusevents.checkin.service;

import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInReason;
import com.campusevents.checkin.model.RegistrationRecord;
import java.time.Instant;
import java.util.UUID;

public record CheckInResult(
    CheckInOutcome outcome,
    CheckInReason reason,
    RegistrationRecord registration,
    Instant checkedInAt,
    UUID recordId) {

  public boolean accepted() {
    return outcome == CheckInOutcome.ACCEPTED;
  }

  public String message() {
    return switch (outcome) {
      case ACCEPTED -> "checked in at " + checkedInAt;
      case DUPLICATE -> "already checked in at " + checkedInAt;
      case INVALID, EXPIRED -> reason == null ? outcome.name().toLowerCase() : reason.message();
    };
  }
}
