package com.campusevents.checkin.api;

import com.campusevents.checkin.report.ReportFormat;
import com.campusevents.checkin.service.AttendanceReportService;
import com.campusevents.checkin.service.ExportedReport;

import lombok.RequiredArgsConstructor;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ReportController {

    private final AttendanceReportService reportService;

    @GetMapping("/events/{event_id}/report")
    public ResponseEntity<byte[]> report(
            @PathVariable("event_id") String eventId,
            @RequestParam(value = "format", required = false) String format,
            @RequestParam(value = "attendance_only", defaultValue = "false") boolean attendanceOnly) {
        ExportedReport exported =
                reportService.export(eventId, ReportFormat.fromParameter(format), attendanceOnly);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exported.format().contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(exported.fileName()).build().toString())
                .body(exported.content());
    }
}
