/*
 * どこで: Check-in データアクセス
 * 何を: registration_audit の登録/参照を行う
 * なぜ: 管理操作の根拠を後から確認できるようにするため
 */
package com.campusevents.checkin.repository;

import static com.campusevents.common.JdbcTimestampUtils.getInstant;
import static com.campusevents.common.JdbcTimestampUtils.toTimestamp;

import com.campusevents.checkin.model.RegistrationAuditRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RegistrationAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(RegistrationAuditRecord record) {
    String sql = """
        INSERT INTO registration_audit (
          audit_id,
          occurred_at,
          registration_id,
          action,
          actor_id,
          reason,
          request_id,
          detail
        ) VALUES (
          :auditId,
          :occurredAt,
          :registrationId,
          :action,
          :actorId,
          :reason,
          :requestId,
          :detail::jsonb
        )
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("auditId", record.auditId())
        .addValue("occurredAt", toTimestamp(record.occurredAt()))
        .addValue("registrationId", record.registrationId())
        .addValue("action", record.action())
        .addValue("actorId", record.actorId())
        .addValue("reason", record.reason())
        .addValue("requestId", record.requestId())
        .addValue("detail", record.detailJson());
    return jdbcTemplate.update(sql, params);
  }

  public List<RegistrationAuditRecord> findByRegistrationId(UUID registrationId) {
    String sql = """
        SELECT audit_id, occurred_at, registration_id, action, actor_id, reason, request_id,
               detail::text AS detail_text
        FROM registration_audit
        WHERE registration_id = :registrationId
        ORDER BY occurred_at, audit_id
        """;
    MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("registrationId", registrationId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private RegistrationAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RegistrationAuditRecord(
        UUID.fromString(rs.getString("audit_id")),
        getInstant(rs, "occurred_at"),
        UUID.fromString(rs.getString("registration_id")),
        rs.getString("action"),
        rs.getString("actor_id"),
        rs.getString("reason"),
        rs.getString("request_id"),
        rs.getString("detail_text"));
  }
}
