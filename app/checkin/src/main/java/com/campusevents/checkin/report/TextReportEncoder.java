package com.campusevents.checkin.report;

import com.campusevents.checkin.model.AttendanceRow;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

@Component
public class TextReportEncoder implements ReportEncoder {

  @Override
  public ReportFormat format() {
    return ReportFormat.TEXT;
  }

  @Override
  public byte[] encode(AttendanceReport report) {
    StringBuilder out = new StringBuilder();
    out.append("Attendance report: ").append(report.eventId()).append('\n');
    out.append("Registrations: ").append(report.rows().size()).append('\n');
    out.append('\n');
    FixedWidthTable table = FixedWidthTable.of(report.rows());
    table.appendHeader(out);
    for (AttendanceRow row : report.rows()) {
      table.appendRow(out, row);
    }
    return out.toString().getBytes(StandardCharsets.UTF_8);
  }
}
