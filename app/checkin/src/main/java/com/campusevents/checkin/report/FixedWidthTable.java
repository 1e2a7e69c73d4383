package com.campusevents.checkin.report;

import com.campusevents.checkin.model.AttendanceRow;
import java.util.List;

/** TEXT 形式の固定幅の表組み。列幅は全行から決める。 */
final class FixedWidthTable {

  private static final String COLUMN_GAP = "  ";

  private final int[] widths;

  private FixedWidthTable(int[] widths) {
    this.widths = widths;
  }

  static FixedWidthTable of(List<AttendanceRow> rows) {
    int[] widths = new int[ReportColumns.HEADERS.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = ReportColumns.HEADERS.get(i).length();
    }
    for (AttendanceRow row : rows) {
      String[] values = ReportColumns.textValues(row);
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], values[i].length());
      }
    }
    return new FixedWidthTable(widths);
  }

  void appendHeader(StringBuilder out) {
    appendLine(out, ReportColumns.HEADERS.toArray(String[]::new));
    String[] rules = new String[widths.length];
    for (int i = 0; i < widths.length; i++) {
      rules[i] = "-".repeat(widths[i]);
    }
    appendLine(out, rules);
  }

  void appendRow(StringBuilder out, AttendanceRow row) {
    appendLine(out, ReportColumns.textValues(row));
  }

  private void appendLine(StringBuilder out, String[] values) {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        line.append(COLUMN_GAP);
      }
      line.append(values[i]).append(" ".repeat(widths[i] - values[i].length()));
    }
    out.append(line.toString().stripTrailing()).append('\n');
  }
}
