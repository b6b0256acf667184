/*
 * どこで: Attendance データアクセス
 * 何を: user_identities (投稿者 ID → 内部ユーザー ID) を参照する
 * なぜ: チャット上の投稿者を勤怠の集計単位であるユーザーへ対応付けるため
 */
package com.example.attendance.repository;

import com.example.attendance.model.UserIdentity;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserIdentityRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserIdentity> findByExternalId(String tenantId, String externalId) {
    final String sql =
        """
        SELECT user_id, display_name
        FROM user_identities
        WHERE tenant_id = :tenantId
          AND external_id = :externalId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("externalId", externalId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) -> new UserIdentity(rs.getString("user_id"), rs.getString("display_name")))
        .stream()
        .findFirst();
  }

  /**
   * 役割: 内部ユーザー ID ごとの表示名を返す。
   * 動作: 1 ユーザーに複数の外部 ID がある場合は最初に登録された表示名を使う。
   */
  public Map<String, String> findDisplayNames(String tenantId, Collection<String> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    final String sql =
        """
        SELECT DISTINCT ON (user_id) user_id, display_name
        FROM user_identities
        WHERE tenant_id = :tenantId
          AND user_id IN (:userIds)
          AND display_name IS NOT NULL
        ORDER BY user_id, created_at ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("userIds", userIds);
    final Map<String, String> names = new HashMap<>();
    jdbcTemplate.query(
        sql, params, rs -> {
          names.put(rs.getString("user_id"), rs.getString("display_name"));
        });
    return names;
  }
}
