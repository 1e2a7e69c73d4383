package com.campusevents.checkin.service;

import com.campusevents.checkin.model.CheckInRecord;
import java.util.List;
import java.util.UUID;

/**
 * 登録 1 件分のスキャン記録と連鎖検証の結果。
 *
 * @param brokenRecordId 連鎖が最初に崩れた記録。intact の場合は null
 */
public record CheckInAuditTrail(
    UUID registrationId, List<CheckInRecord> records, boolean intact, UUID brokenRecordId) {

  public CheckInAuditTrail {
    records = records == null ? List.of() : List.copyOf(records);
  }
}
