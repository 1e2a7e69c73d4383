/*
 * どこで: Check-in API
 * 何を: 登録 1 件分のスキャン記録と連鎖検証結果を返す
 * なぜ: 受理/拒否の紛争時に根拠を提示するため
 */
package com.campusevents.checkin.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckInAuditResponse(
    UUID registrationId, boolean chainIntact, UUID brokenRecordId, List<CheckInRecordSummary> records) {
  public CheckInAuditResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (records != null) {
      records = Collections.unmodifiableList(new ArrayList<>(records));
    }
  }

  @Override
  public List<CheckInRecordSummary> records() {
    if (records == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(records));
  }
}
