package com.campusevents.checkin.report;

import com.campusevents.checkin.model.AttendanceRow;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/** 全形式で共通の列定義。 */
final class ReportColumns {

  static final List<String> HEADERS =
      List.of(
          "Registration ID",
          "Subject ID",
          "State",
          "Registered At",
          "Checked In At",
          "Checked In Device");

  static final List<String> KEYS =
      List.of(
          "registration_id",
          "subject_id",
          "state",
          "registered_at",
          "checked_in_at",
          "checked_in_device");

  private ReportColumns() {}

  /** 欠損値は null のまま返す。テキスト系は空文字へ置き換えて使う。 */
  static List<String> values(AttendanceRow row) {
    return Arrays.asList(
        row.registrationId().toString(),
        row.subjectId(),
        row.state().name(),
        format(row.registeredAt()),
        format(row.checkedInAt()),
        row.checkedInDevice());
  }

  static String[] textValues(AttendanceRow row) {
    return values(row).stream().map(value -> value == null ? "" : value).toArray(String[]::new);
  }

  private static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
