/*
 * どこで: CheckInRecordRepository の統合テスト
 * 何を: 追記専用トリガと受理 1 件制限のインデックスを検証する
 * なぜ: アプリ外からの更新でも監査記録が書き換えられないことを保証するため
 */
package com.campusevents.checkin.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.campusevents.checkin.AbstractPostgresContainerTest;
import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInRecord;
import com.campusevents.checkin.model.RegistrationRecord;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CheckInRecordRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MICROS);

  @Autowired private CheckInRecordRepository recordRepository;
  @Autowired private RegistrationRepository registrationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private RegistrationRecord registration;

  @BeforeEach
  void setUp() {
    jdbcTemplate
        .getJdbcOperations()
        .execute("TRUNCATE check_in_records, registration_audit, registrations");
    registration =
        registrationRepository
            .insertIfAbsent(UUID.randomUUID(), "student-1", "event-1", new byte[32], NOW, null)
            .orElseThrow();
  }

  @Test
  void appendAssignsSequenceAndLatestHashFollowsIt() {
    final CheckInRecord first = recordRepository.append(record(CheckInOutcome.ACCEPTED, null, "a"));
    final CheckInRecord second =
        recordRepository.append(record(CheckInOutcome.DUPLICATE, "a".repeat(64), "b"));

    assertThat(second.recordSeq()).isGreaterThan(first.recordSeq());
    assertThat(recordRepository.findLatestHash(registration.registrationId()))
        .contains("b".repeat(64));
    assertThat(recordRepository.findByRegistrationId(registration.registrationId()))
        .extracting(CheckInRecord::outcome)
        .containsExactly(CheckInOutcome.ACCEPTED, CheckInOutcome.DUPLICATE);
  }

  @Test
  void secondAcceptedRecordForRegistrationIsRejected() {
    recordRepository.append(record(CheckInOutcome.ACCEPTED, null, "a"));

    assertThatThrownBy(
            () -> recordRepository.append(record(CheckInOutcome.ACCEPTED, "a".repeat(64), "b")))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void updateAndDeleteAreRejectedByTrigger() {
    recordRepository.append(record(CheckInOutcome.ACCEPTED, null, "a"));
    final MapSqlParameterSource params = new MapSqlParameterSource();

    assertThatThrownBy(
            () -> jdbcTemplate.update("UPDATE check_in_records SET device_id = 'forged'", params))
        .isInstanceOf(DataAccessException.class)
        .hasMessageContaining("append-only");
    assertThatThrownBy(() -> jdbcTemplate.update("DELETE FROM check_in_records", params))
        .isInstanceOf(DataAccessException.class)
        .hasMessageContaining("append-only");
  }

  private CheckInRecord record(CheckInOutcome outcome, String prevHash, String hashChar) {
    return new CheckInRecord(
        UUID.randomUUID(),
        0L,
        registration.registrationId(),
        outcome,
        null,
        "gate-a",
        "d".repeat(64),
        NOW,
        prevHash,
        hashChar.repeat(64));
  }
}
