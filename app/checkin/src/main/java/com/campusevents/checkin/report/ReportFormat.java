package com.campusevents.checkin.report;

import java.util.Locale;

public enum ReportFormat {
  CSV("csv", "text/csv;charset=UTF-8"),
  TEXT("txt", "text/plain;charset=UTF-8"),
  PAGED("pdf", "application/pdf"),
  XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
  JSON("json", "application/json");

  private final String fileExtension;
  private final String contentType;

  ReportFormat(String fileExtension, String contentType) {
    this.fileExtension = fileExtension;
    this.contentType = contentType;
  }

  public String fileExtension() {
    return fileExtension;
  }

  public String contentType() {
    return contentType;
  }

  /**
   * クエリパラメータ (csv|text|paged|xlsx|json) を解決する。大文字小文字は区別しない。
   * pdf と excel はそれぞれ PAGED と XLSX の別名として受け付ける。
   */
  public static ReportFormat fromParameter(String value) {
    if (value == null || value.isBlank()) {
      return CSV;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if ("PDF".equals(normalized)) {
      return PAGED;
    }
    if ("EXCEL".equals(normalized)) {
      return XLSX;
    }
    try {
      return ReportFormat.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unsupported report format: " + value, ex);
    }
  }
}
