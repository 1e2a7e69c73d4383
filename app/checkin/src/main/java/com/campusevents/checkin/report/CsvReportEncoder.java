package com.campusevents.checkin.report;

import com.campusevents.checkin.model.AttendanceRow;
import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/** 表計算ソフトで文字化けしないよう、先頭に UTF-8 BOM を付ける。 */
@Component
public class CsvReportEncoder implements ReportEncoder {

  static final String UTF8_BOM = "\uFEFF";

  @Override
  public ReportFormat format() {
    return ReportFormat.CSV;
  }

  @Override
  public byte[] encode(AttendanceReport report) {
    StringWriter buffer = new StringWriter();
    buffer.write(UTF8_BOM);
    try (CSVWriter writer = new CSVWriter(buffer)) {
      writer.writeNext(ReportColumns.HEADERS.toArray(String[]::new));
      for (AttendanceRow row : report.rows()) {
        writer.writeNext(ReportColumns.textValues(row));
      }
    } catch (IOException ex) {
      throw new IllegalStateException("failed to encode csv report", ex);
    }
    return buffer.toString().getBytes(StandardCharsets.UTF_8);
  }
}
