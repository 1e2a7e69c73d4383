/*
 * どこで: Check-in データアクセス
 * 何を: registrations の発行/参照/条件付き状態更新を行う
 * なぜ: 一意制約と行単位の compare-and-set を DB に委ね、競合時も不変条件を守るため
 */
package com.campusevents.checkin.repository;

import static com.campusevents.common.JdbcTimestampUtils.getInstant;
import static com.campusevents.common.JdbcTimestampUtils.toTimestamp;

import com.campusevents.checkin.model.RegistrationRecord;
import com.campusevents.checkin.model.RegistrationState;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class RegistrationRepository {

  private static final String COLUMNS =
      """
      registration_id, issue_seq, subject_id, event_id, token_secret, state,
      created_at, checked_in_at, voided_at, check_in_closes_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<RegistrationRecord> insertIfAbsent(
      UUID registrationId,
      String subjectId,
      String eventId,
      byte[] tokenSecret,
      Instant createdAt,
      Instant checkInClosesAt) {
    // (subject_id, event_id) の一意制約で重複を判定する。衝突時は空結果を返す。
    final String sql =
        """
        INSERT INTO registrations (
          registration_id,
          subject_id,
          event_id,
          token_secret,
          state,
          created_at,
          check_in_closes_at
        ) VALUES (
          :registrationId,
          :subjectId,
          :eventId,
          :tokenSecret,
          :state,
          :createdAt,
          :checkInClosesAt
        )
        ON CONFLICT (subject_id, event_id) DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("registrationId", registrationId)
            .addValue("subjectId", subjectId)
            .addValue("eventId", eventId)
            .addValue("tokenSecret", tokenSecret)
            .addValue("state", RegistrationState.ISSUED.name())
            .addValue("createdAt", toTimestamp(createdAt))
            .addValue("checkInClosesAt", toTimestamp(checkInClosesAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RegistrationRecord> findById(UUID registrationId) {
    final String sql = "SELECT " + COLUMNS + " FROM registrations WHERE registration_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", registrationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<RegistrationRecord> lockById(UUID registrationId) {
    // 同一 registration へのスキャンだけを直列化する行ロック。他の登録とは競合しない。
    final String sql =
        "SELECT " + COLUMNS + " FROM registrations WHERE registration_id = :id FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", registrationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RegistrationRecord> markCheckedIn(
      UUID registrationId, RegistrationState expectedState, Instant checkedInAt) {
    // 現在状態が expectedState の場合のみ更新する compare-and-set
    final String sql =
        """
        UPDATE registrations
        SET state = 'CHECKED_IN',
            checked_in_at = :checkedInAt
        WHERE registration_id = :id
          AND state = :expectedState
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", registrationId)
            .addValue("expectedState", expectedState.name())
            .addValue("checkedInAt", toTimestamp(checkedInAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RegistrationRecord> markVoidIfIssued(UUID registrationId, Instant voidedAt) {
    final String sql =
        """
        UPDATE registrations
        SET state = 'VOID',
            voided_at = :voidedAt
        WHERE registration_id = :id
          AND state = 'ISSUED'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", registrationId)
            .addValue("voidedAt", toTimestamp(voidedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RegistrationRecord> forceVoid(UUID registrationId, Instant voidedAt) {
    // 管理者による上書き。checked_in_at は履歴として残す。
    final String sql =
        """
        UPDATE registrations
        SET state = 'VOID',
            voided_at = :voidedAt
        WHERE registration_id = :id
          AND state <> 'VOID'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", registrationId)
            .addValue("voidedAt", toTimestamp(voidedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<RegistrationRecord> findByEventId(String eventId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM registrations WHERE event_id = :eventId ORDER BY issue_seq";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private RegistrationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RegistrationRecord(
        UUID.fromString(rs.getString("registration_id")),
        rs.getLong("issue_seq"),
        rs.getString("subject_id"),
        rs.getString("event_id"),
        rs.getBytes("token_secret"),
        RegistrationState.valueOf(rs.getString("state")),
        getInstant(rs, "created_at"),
        getInstant(rs, "checked_in_at"),
        getInstant(rs, "voided_at"),
        getInstant(rs, "check_in_closes_at"));
  }
}
