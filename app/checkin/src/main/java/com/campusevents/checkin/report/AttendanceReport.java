package com.campusevents.checkin.report;

import com.campusevents.checkin.model.AttendanceRow;
import java.util.List;

/** 出席レポートの中間表現。行は発行順で、エンコーダはこの順序を変えない。 */
public record AttendanceReport(String eventId, List<AttendanceRow> rows) {

  public AttendanceReport {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }
}
