/*
 * どこで: Check-in レポート
 * 何を: 印刷向けのページ分割 PDF を生成する
 * なぜ: 受付で紙の名簿として配布できるよう、各ページに見出し行とページ番号を付けるため
 */
package com.campusevents.checkin.report;

import com.campusevents.checkin.config.CheckInReportProperties;
import com.campusevents.checkin.model.AttendanceRow;
import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfwriter.compress.CompressParameters;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PagedReportEncoder implements ReportEncoder {

  static final String EMPTY_MARKER = "(no registrations)";

  // A4 横向き
  static final PDRectangle PAGE_SIZE =
      new PDRectangle(PDRectangle.A4.getHeight(), PDRectangle.A4.getWidth());

  private static final float MARGIN = 15f;
  private static final float TITLE_FONT_SIZE = 12f;
  private static final float LABEL_FONT_SIZE = 8f;
  private static final float CELL_FONT_SIZE = 7f;
  private static final float HEADER_BLOCK_HEIGHT = 40f;
  private static final float ROW_HEIGHT = 11f;
  private static final float CELL_PADDING = 2f;
  private static final float GRID_LINE_WIDTH = 0.3f;
  private static final float[] COLUMN_WIDTHS = {160f, 150f, 70f, 120f, 120f, 192f};
  private static final Color HEADER_BACKGROUND = new Color(0x2c, 0x7b, 0xe5);

  private final CheckInReportProperties properties;

  @Override
  public ReportFormat format() {
    return ReportFormat.PAGED;
  }

  @Override
  public byte[] encode(AttendanceReport report) {
    List<AttendanceRow> rows = report.rows();
    int rowsPerPage = rowsPerPage();
    int pageCount = Math.max(1, (rows.size() + rowsPerPage - 1) / rowsPerPage);
    PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      assignDocumentId(document, report.eventId());
      for (int page = 1; page <= pageCount; page++) {
        PDPage pdPage = new PDPage(PAGE_SIZE);
        document.addPage(pdPage);
        try (PDPageContentStream content = new PDPageContentStream(document, pdPage)) {
          float top = PAGE_SIZE.getHeight() - MARGIN;
          writeText(
              content,
              bold,
              TITLE_FONT_SIZE,
              MARGIN,
              top - TITLE_FONT_SIZE,
              printable("Attendance report: " + report.eventId()));
          writeText(
              content,
              regular,
              LABEL_FONT_SIZE,
              MARGIN,
              top - TITLE_FONT_SIZE - LABEL_FONT_SIZE - 6f,
              "Page " + page + " of " + pageCount);
          float tableTop = top - HEADER_BLOCK_HEIGHT;
          if (rows.isEmpty()) {
            writeText(content, regular, LABEL_FONT_SIZE, MARGIN, tableTop - ROW_HEIGHT, EMPTY_MARKER);
            continue;
          }
          int from = (page - 1) * rowsPerPage;
          int to = Math.min(rows.size(), from + rowsPerPage);
          drawTable(content, regular, bold, rows.subList(from, to), tableTop);
        }
      }
      document.save(out, CompressParameters.NO_COMPRESSION);
      return out.toByteArray();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to render paged report", ex);
    }
  }

  /** 設定値がページに収まらない場合は、収まる行数に丸める。 */
  int rowsPerPage() {
    float tableHeight = PAGE_SIZE.getHeight() - 2 * MARGIN - HEADER_BLOCK_HEIGHT;
    int fitting = (int) Math.floor(tableHeight / ROW_HEIGHT) - 1;
    return Math.max(1, Math.min(properties.rowsPerPage(), fitting));
  }

  private static void drawTable(
      PDPageContentStream content, PDFont regular, PDFont bold, List<AttendanceRow> rows, float top)
      throws IOException {
    float tableWidth = 0f;
    for (float width : COLUMN_WIDTHS) {
      tableWidth += width;
    }
    content.setNonStrokingColor(HEADER_BACKGROUND);
    content.addRect(MARGIN, top - ROW_HEIGHT, tableWidth, ROW_HEIGHT);
    content.fill();

    content.setNonStrokingColor(Color.WHITE);
    float y = drawRow(content, bold, ReportColumns.HEADERS.toArray(String[]::new), top);
    content.setNonStrokingColor(Color.BLACK);
    for (AttendanceRow row : rows) {
      y = drawRow(content, regular, ReportColumns.textValues(row), y);
    }

    content.setLineWidth(GRID_LINE_WIDTH);
    for (float lineY = top; lineY >= y - 0.01f; lineY -= ROW_HEIGHT) {
      content.moveTo(MARGIN, lineY);
      content.lineTo(MARGIN + tableWidth, lineY);
    }
    float x = MARGIN;
    for (int i = 0; i <= COLUMN_WIDTHS.length; i++) {
      content.moveTo(x, top);
      content.lineTo(x, y);
      if (i < COLUMN_WIDTHS.length) {
        x += COLUMN_WIDTHS[i];
      }
    }
    content.stroke();
  }

  private static float drawRow(PDPageContentStream content, PDFont font, String[] values, float top)
      throws IOException {
    float x = MARGIN;
    float baseline = top - ROW_HEIGHT + CELL_PADDING + 1f;
    for (int i = 0; i < values.length; i++) {
      String text = fit(font, printable(values[i]), COLUMN_WIDTHS[i] - 2 * CELL_PADDING);
      if (!text.isEmpty()) {
        writeText(content, font, CELL_FONT_SIZE, x + CELL_PADDING, baseline, text);
      }
      x += COLUMN_WIDTHS[i];
    }
    return top - ROW_HEIGHT;
  }

  private static void writeText(
      PDPageContentStream content, PDFont font, float size, float x, float y, String text)
      throws IOException {
    content.beginText();
    content.setFont(font, size);
    content.newLineAtOffset(x, y);
    content.showText(text);
    content.endText();
  }

  private static String fit(PDFont font, String text, float maxWidth) throws IOException {
    String fitted = text;
    while (!fitted.isEmpty()
        && font.getStringWidth(fitted) / 1000f * CELL_FONT_SIZE > maxWidth) {
      fitted = fitted.substring(0, fitted.length() - 1);
    }
    return fitted;
  }

  /** 標準 14 フォントで描けない文字は '?' に置き換える。 */
  static String printable(String value) {
    StringBuilder out = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      out.append(c >= 0x20 && c <= 0x7e ? c : '?');
    }
    return out.toString();
  }

  // 同じイベントからは同じ /ID を書き出す
  private static void assignDocumentId(PDDocument document, String eventId) {
    UUID id = UUID.nameUUIDFromBytes(("attendance:" + eventId).getBytes(StandardCharsets.UTF_8));
    byte[] bytes =
        ByteBuffer.allocate(16)
            .putLong(id.getMostSignificantBits())
            .putLong(id.getLeastSignificantBits())
            .array();
    COSArray ids = new COSArray();
    ids.add(new COSString(bytes));
    ids.add(new COSString(bytes));
    document.getDocument().getTrailer().setItem(COSName.ID, ids);
  }
}
