/*
 * どこで: Attendance データアクセス
 * 何を: attendance_events (監査ログ) の追記/参照と休憩実績時間の補正を行う
 * なぜ: 取り込みの冪等性を DB の一意制約で保証し、分析/履歴 API に同じ記録を提供するため
 */
package com.example.attendance.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.attendance.model.AttendanceEventKind;
import com.example.attendance.model.AttendanceEventRecord;
import com.example.attendance.model.BreakReasonCategory;
import com.example.attendance.model.ClassifierSource;
import com.example.attendance.model.Urgency;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AttendanceEventRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT event_id, tenant_id, user_id, event_type, confidence, reason, reason_category,
             urgency, source, event_time, expected_return_time, actual_duration_minutes,
             channel_id, message_id, raw_message, created_at
      FROM attendance_events
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: 監査ログへ 1 件追記する。
   * 動作: 同一 (tenant, channel, message) が既にあれば何もせず空を返す。
   */
  public Optional<AttendanceEventRecord> insertIfAbsent(AttendanceEventRecord record) {
    final String sql =
        """
        INSERT INTO attendance_events (
          event_id,
          tenant_id,
          user_id,
          event_type,
          confidence,
          reason,
          reason_category,
          urgency,
          source,
          event_time,
          expected_return_time,
          actual_duration_minutes,
          channel_id,
          message_id,
          raw_message,
          created_at
        ) VALUES (
          :eventId,
          :tenantId,
          :userId,
          :eventType,
          :confidence,
          :reason,
          :reasonCategory,
          :urgency,
          :source,
          :eventTime,
          :expectedReturnTime,
          :actualDurationMinutes,
          :channelId,
          :messageId,
          :rawMessage,
          :createdAt
        )
        ON CONFLICT (tenant_id, channel_id, message_id) DO NOTHING
        RETURNING event_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", record.eventId())
            .addValue("tenantId", record.tenantId())
            .addValue("userId", record.userId())
            .addValue("eventType", record.kind().value())
            .addValue("confidence", record.confidence())
            .addValue("reason", record.reason())
            .addValue(
                "reasonCategory",
                record.reasonCategory() == null ? null : record.reasonCategory().value())
            .addValue("urgency", record.urgency().value())
            .addValue("source", record.source().value())
            .addValue("eventTime", toTimestamp(record.eventTime()))
            .addValue("expectedReturnTime", toTimestamp(record.expectedReturnTime()))
            .addValue("actualDurationMinutes", record.actualDurationMinutes())
            .addValue("channelId", record.channelId())
            .addValue("messageId", record.messageId())
            .addValue("rawMessage", record.rawMessage())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    final List<UUID> inserted =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getObject("event_id", UUID.class));
    return inserted.isEmpty() ? Optional.empty() : Optional.of(record);
  }

  public boolean existsBySource(String tenantId, String channelId, String messageId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM attendance_events
          WHERE tenant_id = :tenantId
            AND channel_id = :channelId
            AND message_id = :messageId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("channelId", channelId)
            .addValue("messageId", messageId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public Optional<AttendanceEventRecord> findBySource(
      String tenantId, String channelId, String messageId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId
              AND channel_id = :channelId
              AND message_id = :messageId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("channelId", channelId)
            .addValue("messageId", messageId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 役割: 休憩終了に対応する休憩開始イベントの実績時間を書き込む。
   * 動作: breakStartAt ±1 分に収まる最新の BREAK_START 1 件だけを更新し、更新件数を返す。
   */
  public int updateLatestBreakStartDuration(
      String tenantId, String userId, Instant breakStartAt, int actualDurationMinutes) {
    final String sql =
        """
        UPDATE attendance_events
        SET actual_duration_minutes = :actualDurationMinutes
        WHERE event_id = (
          SELECT event_id
          FROM attendance_events
          WHERE tenant_id = :tenantId
            AND user_id = :userId
            AND event_type = :eventType
            AND event_time BETWEEN :windowStart AND :windowEnd
          ORDER BY event_time DESC
          LIMIT 1
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("actualDurationMinutes", actualDurationMinutes)
            .addValue("tenantId", tenantId)
            .addValue("userId", userId)
            .addValue("eventType", AttendanceEventKind.BREAK_START.value())
            .addValue("windowStart", toTimestamp(breakStartAt.minusSeconds(60)))
            .addValue("windowEnd", toTimestamp(breakStartAt.plusSeconds(60)));
    return jdbcTemplate.update(sql, params);
  }

  /** 再生で実績時間を書き直す前に、ユーザーの休憩開始イベントの実績時間を消す。 */
  public int clearBreakStartDurations(String tenantId, String userId) {
    final String sql =
        """
        UPDATE attendance_events
        SET actual_duration_minutes = NULL
        WHERE tenant_id = :tenantId
          AND user_id = :userId
          AND event_type = :eventType
          AND actual_duration_minutes IS NOT NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("userId", userId)
            .addValue("eventType", AttendanceEventKind.BREAK_START.value());
    return jdbcTemplate.update(sql, params);
  }

  /** ユーザーの記録済みイベントのうち最も新しい発生時刻。 */
  public Optional<Instant> findLatestEventTime(String tenantId, String userId) {
    final String sql =
        """
        SELECT MAX(event_time) AS latest_event_time
        FROM attendance_events
        WHERE tenant_id = :tenantId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("userId", userId);
    return Optional.ofNullable(
        jdbcTemplate.queryForObject(
            sql, params, (rs, rowNum) -> toInstant(rs.getTimestamp("latest_event_time"))));
  }

  /** ユーザーの指定時刻以降のイベントを新しい順に返す。 */
  public List<AttendanceEventRecord> findByUserSince(
      String tenantId, String userId, Instant since) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId
              AND user_id = :userId
              AND event_time >= :since
            ORDER BY event_time DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("userId", userId)
            .addValue("since", toTimestamp(since));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 再生用にユーザーの全イベントを発生時刻順で返す。 */
  public List<AttendanceEventRecord> findAllByUserInEventOrder(String tenantId, String userId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId
              AND user_id = :userId
            ORDER BY event_time ASC, created_at ASC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 未解決ユーザーの記録を除き、テナントの指定時刻以降のイベントを返す。 */
  public List<AttendanceEventRecord> findResolvedByTenantSince(String tenantId, Instant since) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId
              AND user_id IS NOT NULL
              AND event_time >= :since
            ORDER BY event_time ASC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("since", toTimestamp(since));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Map<AttendanceEventKind, Long> countByKindSince(String tenantId, Instant since) {
    final String sql =
        """
        SELECT event_type, COUNT(*) AS event_count
        FROM attendance_events
        WHERE tenant_id = :tenantId
          AND event_time >= :since
        GROUP BY event_type
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("since", toTimestamp(since));
    final Map<AttendanceEventKind, Long> counts = new EnumMap<>(AttendanceEventKind.class);
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          counts.put(
              AttendanceEventKind.fromValue(rs.getString("event_type")), rs.getLong("event_count"));
        });
    return counts;
  }

  public long countDistinctUsersSince(String tenantId, Instant since) {
    final String sql =
        """
        SELECT COUNT(DISTINCT user_id)
        FROM attendance_events
        WHERE tenant_id = :tenantId
          AND user_id IS NOT NULL
          AND event_time >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("since", toTimestamp(since));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private AttendanceEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String reasonCategory = rs.getString("reason_category");
    final int actualDuration = rs.getInt("actual_duration_minutes");
    final Integer actualDurationMinutes = rs.wasNull() ? null : actualDuration;
    return new AttendanceEventRecord(
        rs.getObject("event_id", UUID.class),
        rs.getString("tenant_id"),
        rs.getString("user_id"),
        AttendanceEventKind.fromValue(rs.getString("event_type")),
        rs.getDouble("confidence"),
        rs.getString("reason"),
        reasonCategory == null ? null : BreakReasonCategory.fromValue(reasonCategory),
        Urgency.fromValueOrNormal(rs.getString("urgency")),
        ClassifierSource.fromValue(rs.getString("source")),
        toInstant(rs.getTimestamp("event_time")),
        toInstant(rs.getTimestamp("expected_return_time")),
        actualDurationMinutes,
        rs.getString("channel_id"),
        rs.getString("message_id"),
        rs.getString("raw_message"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
