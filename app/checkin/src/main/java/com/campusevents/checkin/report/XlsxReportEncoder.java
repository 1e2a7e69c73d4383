/*
 * どこで: Check-in レポート
 * 何を: 出欠一覧を Excel (xlsx) のシートとして出力する
 * なぜ: 事務局が表計算ソフトでそのまま集計できるようにするため
 */
package com.campusevents.checkin.report;

import com.campusevents.checkin.model.AttendanceRow;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

@Component
public class XlsxReportEncoder implements ReportEncoder {

  static final String SHEET_NAME = "Registrations";

  @Override
  public ReportFormat format() {
    return ReportFormat.XLSX;
  }

  @Override
  public byte[] encode(AttendanceReport report) {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      XSSFSheet sheet = workbook.createSheet(SHEET_NAME);
      CellStyle headerStyle = workbook.createCellStyle();
      Font headerFont = workbook.createFont();
      headerFont.setBold(true);
      headerStyle.setFont(headerFont);

      Row header = sheet.createRow(0);
      for (int i = 0; i < ReportColumns.HEADERS.size(); i++) {
        header.createCell(i).setCellValue(ReportColumns.HEADERS.get(i));
        header.getCell(i).setCellStyle(headerStyle);
      }
      sheet.createFreezePane(0, 1);

      int rowIndex = 1;
      for (AttendanceRow row : report.rows()) {
        Row sheetRow = sheet.createRow(rowIndex++);
        List<String> values = ReportColumns.values(row);
        for (int i = 0; i < values.size(); i++) {
          // 欠損値はセル自体を作らず空欄にする
          if (values.get(i) != null) {
            sheetRow.createCell(i).setCellValue(values.get(i));
          }
        }
      }
      workbook.write(out);
      return out.toByteArray();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to render xlsx report", ex);
    }
  }
}
