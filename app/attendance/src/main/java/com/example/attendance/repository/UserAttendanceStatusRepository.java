/*
 * どこで: Attendance データアクセス
 * 何を: user_attendance_status (ユーザーごとの現在状態) の排他/参照/更新を行う
 * なぜ: 同一ユーザーの状態遷移を直列化し、チーム状況の参照に最新状態を提供するため
 */
package com.example.attendance.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.attendance.model.UserAttendanceStatusRecord;
import com.example.attendance.model.UserStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class UserAttendanceStatusRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT tenant_id, user_id, status, last_checkin_at, last_checkout_at, last_break_start_at,
             current_break_reason, expected_return_at, today_checkin_at, today_break_count,
             today_total_break_minutes, updated_at
      FROM user_attendance_status
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockByKey(long lockKey) {
    // 同一 (tenant, user) の読み取り〜更新をトランザクション内で直列化する。
    // 行がまだ存在しない初回イベントも対象にするため、行ロックではなく advisory lock を使う。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<UserAttendanceStatusRecord> findByTenantAndUser(String tenantId, String userId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId
              AND user_id = :userId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UserAttendanceStatusRecord> findByTenant(String tenantId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId
            ORDER BY user_id
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("tenantId", tenantId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int upsert(UserAttendanceStatusRecord record) {
    final String sql =
        """
        INSERT INTO user_attendance_status (
          tenant_id,
          user_id,
          status,
          last_checkin_at,
          last_checkout_at,
          last_break_start_at,
          current_break_reason,
          expected_return_at,
          today_checkin_at,
          today_break_count,
          today_total_break_minutes,
          updated_at
        ) VALUES (
          :tenantId,
          :userId,
          :status,
          :lastCheckInAt,
          :lastCheckOutAt,
          :lastBreakStartAt,
          :currentBreakReason,
          :expectedReturnAt,
          :todayCheckInAt,
          :todayBreakCount,
          :todayTotalBreakMinutes,
          :updatedAt
        )
        ON CONFLICT (tenant_id, user_id)
        DO UPDATE SET
          status = EXCLUDED.status,
          last_checkin_at = EXCLUDED.last_checkin_at,
          last_checkout_at = EXCLUDED.last_checkout_at,
          last_break_start_at = EXCLUDED.last_break_start_at,
          current_break_reason = EXCLUDED.current_break_reason,
          expected_return_at = EXCLUDED.expected_return_at,
          today_checkin_at = EXCLUDED.today_checkin_at,
          today_break_count = EXCLUDED.today_break_count,
          today_total_break_minutes = EXCLUDED.today_total_break_minutes,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", record.tenantId())
            .addValue("userId", record.userId())
            .addValue("status", record.status().value())
            .addValue("lastCheckInAt", toTimestamp(record.lastCheckInAt()))
            .addValue("lastCheckOutAt", toTimestamp(record.lastCheckOutAt()))
            .addValue("lastBreakStartAt", toTimestamp(record.lastBreakStartAt()))
            .addValue("currentBreakReason", record.currentBreakReason())
            .addValue("expectedReturnAt", toTimestamp(record.expectedReturnAt()))
            .addValue("todayCheckInAt", toTimestamp(record.todayCheckInAt()))
            .addValue("todayBreakCount", record.todayBreakCount())
            .addValue("todayTotalBreakMinutes", record.todayTotalBreakMinutes())
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  /** 全テナントの日次カウンタを初期化し、更新件数を返す。 */
  public int resetDailyCounters(Instant updatedAt) {
    final String sql =
        """
        UPDATE user_attendance_status
        SET today_checkin_at = NULL,
            today_break_count = 0,
            today_total_break_minutes = 0,
            updated_at = :updatedAt
        WHERE today_checkin_at IS NOT NULL
           OR today_break_count <> 0
           OR today_total_break_minutes <> 0
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  private UserAttendanceStatusRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserAttendanceStatusRecord(
        rs.getString("tenant_id"),
        rs.getString("user_id"),
        UserStatus.fromValue(rs.getString("status")),
        toInstant(rs.getTimestamp("last_checkin_at")),
        toInstant(rs.getTimestamp("last_checkout_at")),
        toInstant(rs.getTimestamp("last_break_start_at")),
        rs.getString("current_break_reason"),
        toInstant(rs.getTimestamp("expected_return_at")),
        toInstant(rs.getTimestamp("today_checkin_at")),
        rs.getInt("today_break_count"),
        rs.getInt("today_total_break_minutes"),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
