/*
 * どこで: AttendanceReportService の統合テスト
 * 何を: 発行順の行・受付済みのみの絞り込み・全形式の決定的出力を検証する
 * なぜ: 同じ台帳状態から常に同じレポートが得られることを保証するため
 */
package com.campusevents.checkin.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.campusevents.checkin.AbstractPostgresContainerTest;
import com.campusevents.checkin.model.AttendanceRow;
import com.campusevents.checkin.model.RegistrationState;
import com.campusevents.checkin.report.AttendanceReport;
import com.campusevents.checkin.report.ReportFormat;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.EnumSet;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AttendanceReportServiceTest extends AbstractPostgresContainerTest {

    private static final String EVENT_ID = "event-1";

    @Autowired
    private AttendanceReportService reportService;

    @Autowired
    private RegistrationLedgerService ledgerService;

    @Autowired
    private CheckInService checkInService;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    private IssuedRegistration alice;
    private IssuedRegistration bob;
    private IssuedRegistration carol;
    private CheckInResult aliceCheckIn;

    @BeforeEach
    void setUp() {
        jdbcTemplate.getJdbcOperations()
                .execute("TRUNCATE check_in_records, registration_audit, registrations");
        alice = ledgerService.issue("alice", EVENT_ID, null);
        bob = ledgerService.issue("bob", EVENT_ID, null);
        carol = ledgerService.issue("carol", EVENT_ID, null);
        ledgerService.issue("dave", "event-2", null);
        // 受付順は C → A。レポートは発行順 A, B, C のまま並ぶ。
        checkInService.attemptCheckIn(carol.artifact(), "gate-b");
        aliceCheckIn = checkInService.attemptCheckIn(alice.artifact(), "gate-a");
        checkInService.attemptCheckIn(alice.artifact(), "gate-c");
    }

    @Test
    void rowsFollowIssuanceOrderWithAcceptedScanDetails() {
        AttendanceReport report = reportService.buildReport(EVENT_ID, false);

        assertThat(report.rows()).extracting(AttendanceRow::subjectId).containsExactly("alice", "bob", "carol");
        AttendanceRow aliceRow = report.rows().get(0);
        assertThat(aliceRow.state()).isEqualTo(RegistrationState.CHECKED_IN);
        assertThat(aliceRow.checkedInAt()).isEqualTo(aliceCheckIn.checkedInAt());
        assertThat(aliceRow.checkedInDevice()).isEqualTo("gate-a");
        AttendanceRow bobRow = report.rows().get(1);
        assertThat(bobRow.state()).isEqualTo(RegistrationState.ISSUED);
        assertThat(bobRow.checkedInAt()).isNull();
        assertThat(bobRow.checkedInDevice()).isNull();
        assertThat(report.rows().get(2).checkedInDevice()).isEqualTo("gate-b");
    }

    @Test
    void attendanceOnlyKeepsCheckedInRows() {
        AttendanceReport report = reportService.buildReport(EVENT_ID, true);

        assertThat(report.rows()).extracting(AttendanceRow::subjectId).containsExactly("alice", "carol");
    }

    @Test
    void voidedRegistrationStaysInFullReport() {
        ledgerService.voidRegistration(bob.registration().registrationId(), "admin-1");

        AttendanceReport report = reportService.buildReport(EVENT_ID, false);

        assertThat(report.rows()).extracting(AttendanceRow::state)
                .containsExactly(RegistrationState.CHECKED_IN, RegistrationState.VOID, RegistrationState.CHECKED_IN);
    }

    @Test
    void everyFormatIsByteIdenticalForUnchangedLedger() {
        // xlsx のコンテナには書き出し時刻が入るため、セル内容で別途比較する
        for (ReportFormat format : EnumSet.complementOf(EnumSet.of(ReportFormat.XLSX))) {
            ExportedReport first = reportService.export(EVENT_ID, format, false);
            ExportedReport second = reportService.export(EVENT_ID, format, false);

            assertThat(second.content()).as("format %s", format).isEqualTo(first.content());
            assertThat(first.fileName()).isEqualTo("event-1_attendance." + format.fileExtension());
        }
    }

    @Test
    void pagedExportUsesConfiguredRowsPerPage() throws IOException {
        ExportedReport exported = reportService.export(EVENT_ID, ReportFormat.PAGED, false);

        assertThat(exported.fileName()).isEqualTo("event-1_attendance.pdf");
        try (PDDocument document = Loader.loadPDF(exported.content())) {
            String text = new PDFTextStripper().getText(document);

            assertThat(document.getNumberOfPages()).isEqualTo(2);
            assertThat(text).contains("Page 1 of 2").contains("Page 2 of 2");
        }
    }

    @Test
    void xlsxExportKeepsAttendanceOnlyRowsInIssuanceOrder() throws IOException {
        ExportedReport exported = reportService.export(EVENT_ID, ReportFormat.XLSX, true);

        assertThat(exported.fileName()).isEqualTo("event-1_attendance.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(exported.content()))) {
            Sheet sheet = workbook.getSheetAt(0);

            assertThat(sheet.getLastRowNum()).isEqualTo(2);
            assertThat(sheet.getRow(1).getCell(1).getStringCellValue()).isEqualTo("alice");
            assertThat(sheet.getRow(2).getCell(1).getStringCellValue()).isEqualTo("carol");
            assertThat(sheet.getRow(1).getCell(5).getStringCellValue()).isEqualTo("gate-a");
        }
    }

    @Test
    void unknownEventYieldsEmptyReport() {
        assertThat(reportService.buildReport("no-such-event", false).rows()).isEmpty();
    }
}
