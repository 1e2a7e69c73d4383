package com.campusevents.checkin.report;

import com.campusevents.checkin.model.AttendanceRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JsonReportEncoder implements ReportEncoder {

  private final ObjectMapper objectMapper;

  @Override
  public ReportFormat format() {
    return ReportFormat.JSON;
  }

  @Override
  public byte[] encode(AttendanceReport report) {
    List<Map<String, String>> rows = new ArrayList<>(report.rows().size());
    for (AttendanceRow row : report.rows()) {
      List<String> values = ReportColumns.values(row);
      Map<String, String> item = new LinkedHashMap<>();
      for (int i = 0; i < ReportColumns.KEYS.size(); i++) {
        item.put(ReportColumns.KEYS.get(i), values.get(i));
      }
      rows.add(item);
    }
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("event_id", report.eventId());
    document.put("row_count", rows.size());
    document.put("rows", rows);
    try {
      // 改行コードが環境依存にならないよう整形せずに出力する
      return objectMapper.writeValueAsBytes(document);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode json report", ex);
    }
  }
}
