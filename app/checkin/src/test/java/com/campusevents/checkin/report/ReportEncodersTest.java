package com.campusevents.checkin.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ReportEncodersTest {

  @Test
  void resolvesEncoderByFormat() {
    final TextReportEncoder text = new TextReportEncoder();
    final CsvReportEncoder csv = new CsvReportEncoder();
    final ReportEncoders encoders = new ReportEncoders(List.of(text, csv));

    assertThat(encoders.encoderFor(ReportFormat.TEXT)).isSameAs(text);
    assertThat(encoders.encoderFor(ReportFormat.CSV)).isSameAs(csv);
    assertThatThrownBy(() -> encoders.encoderFor(ReportFormat.JSON))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsDuplicateRegistrations() {
    assertThatThrownBy(
            () -> new ReportEncoders(List.of(new TextReportEncoder(), new TextReportEncoder())))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void parsesFormatParameter() {
    assertThat(ReportFormat.fromParameter(null)).isEqualTo(ReportFormat.CSV);
    assertThat(ReportFormat.fromParameter("Paged")).isEqualTo(ReportFormat.PAGED);
    assertThat(ReportFormat.fromParameter("json")).isEqualTo(ReportFormat.JSON);
    assertThat(ReportFormat.fromParameter("xlsx")).isEqualTo(ReportFormat.XLSX);
    assertThatThrownBy(() -> ReportFormat.fromParameter("docx"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("unsupported report format: docx");
  }

  @Test
  void acceptsPdfAndExcelAliases() {
    assertThat(ReportFormat.fromParameter("pdf")).isEqualTo(ReportFormat.PAGED);
    assertThat(ReportFormat.fromParameter("Excel")).isEqualTo(ReportFormat.XLSX);
    assertThat(ReportFormat.PAGED.contentType()).isEqualTo("application/pdf");
    assertThat(ReportFormat.XLSX.fileExtension()).isEqualTo("xlsx");
  }
}
