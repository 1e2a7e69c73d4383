/*
 * どこで: Check-in データアクセス
 * 何を: check_in_records の追記と参照を担う
 * なぜ: スキャン結果を状態行とは独立した追記専用ログとして残すため
 */
package com.campusevents.checkin.repository;

import static com.campusevents.common.JdbcTimestampUtils.getInstant;
import static com.campusevents.common.JdbcTimestampUtils.toTimestamp;

import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInReason;
import com.campusevents.checkin.model.CheckInRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CheckInRecordRepository {

  private static final String COLUMNS =
      """
      record_id, record_seq, registration_id, outcome, reason, device_id,
      artifact_digest, occurred_at, prev_hash, record_hash
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public CheckInRecord append(CheckInRecord record) {
    // record_seq は DB 採番。UPDATE/DELETE はトリガで拒否される。
    final String sql =
        """
        INSERT INTO check_in_records (
          record_id,
          registration_id,
          outcome,
          reason,
          device_id,
          artifact_digest,
          occurred_at,
          prev_hash,
          record_hash
        ) VALUES (
          :recordId,
          :registrationId,
          :outcome,
          :reason,
          :deviceId,
          :artifactDigest,
          :occurredAt,
          :prevHash,
          :recordHash
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recordId", record.recordId())
            .addValue("registrationId", record.registrationId())
            .addValue("outcome", record.outcome().name())
            .addValue("reason", record.reason() == null ? null : record.reason().name())
            .addValue("deviceId", record.deviceId())
            .addValue("artifactDigest", record.artifactDigest())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("prevHash", record.prevHash())
            .addValue("recordHash", record.recordHash());
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<String> findLatestHash(UUID registrationId) {
    final String sql =
        """
        SELECT record_hash
        FROM check_in_records
        WHERE registration_id = :registrationId
        ORDER BY record_seq DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("registrationId", registrationId);
    return jdbcTemplate.queryForList(sql, params, String.class).stream().findFirst();
  }

  public List<CheckInRecord> findByRegistrationId(UUID registrationId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM check_in_records WHERE registration_id = :registrationId ORDER BY record_seq";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("registrationId", registrationId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private CheckInRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String registrationId = rs.getString("registration_id");
    final String reason = rs.getString("reason");
    return new CheckInRecord(
        UUID.fromString(rs.getString("record_id")),
        rs.getLong("record_seq"),
        registrationId == null ? null : UUID.fromString(registrationId),
        CheckInOutcome.valueOf(rs.getString("outcome")),
        reason == null ? null : CheckInReason.valueOf(reason),
        rs.getString("device_id"),
        rs.getString("artifact_digest"),
        getInstant(rs, "occurred_at"),
        rs.getString("prev_hash"),
        rs.getString("record_hash"));
  }
}
