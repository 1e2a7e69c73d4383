package com.campusevents.checkin.service;

import com.campusevents.checkin.report.ReportFormat;
import java.util.Arrays;

public record ExportedReport(ReportFormat format, String fileName, byte[] content) {

  public ExportedReport {
    content = content == null ? new byte[0] : content.clone();
  }

  @Override
  public byte[] content() {
    return content.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ExportedReport that)) {
      return false;
    }
    return format == that.format
        && fileName.equals(that.fileName)
        && Arrays.equals(content, that.content);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * format.hashCode() + fileName.hashCode()) + Arrays.hashCode(content);
  }

  @Override
  public String toString() {
    return "ExportedReport[format=" + format + ", fileName=" + fileName + ", bytes=" + content.length + "]";
  }
}
