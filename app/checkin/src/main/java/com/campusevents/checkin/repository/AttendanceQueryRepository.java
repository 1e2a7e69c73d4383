/*
 * どこで: Check-in データアクセス
 * 何を: イベント単位の出席一覧を発行順で読み出す
 * なぜ: レポートの並び順を DB の採番列で固定し、何度出力しても同一になるようにするため
 */
package com.campusevents.checkin.repository;

import static com.campusevents.common.JdbcTimestampUtils.getInstant;

import com.campusevents.checkin.model.AttendanceRow;
import com.campusevents.checkin.model.RegistrationState;
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
public class AttendanceQueryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<AttendanceRow> findByEventId(String eventId) {
    // ACCEPTED は部分一意インデックスで 1 件以下なので LEFT JOIN しても行は増えない。
    final String sql =
        """
        SELECT r.registration_id,
               r.subject_id,
               r.state,
               r.created_at,
               c.occurred_at AS checked_in_at,
               c.device_id AS checked_in_device
        FROM registrations r
        LEFT JOIN check_in_records c
          ON c.registration_id = r.registration_id
         AND c.outcome = 'ACCEPTED'
        WHERE r.event_id = :eventId
        ORDER BY r.issue_seq
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private AttendanceRow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AttendanceRow(
        UUID.fromString(rs.getString("registration_id")),
        rs.getString("subject_id"),
        RegistrationState.valueOf(rs.getString("state")),
        getInstant(rs, "created_at"),
        getInstant(rs, "checked_in_at"),
        rs.getString("checked_in_device"));
  }
}
