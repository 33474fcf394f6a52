package com.example.dcim.access.repository;

import com.example.dcim.access.model.AuditAction;
import com.example.dcim.access.model.AuditEntry;
import com.example.dcim.common.JdbcTimestampUtils;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** audit_logs は追記専用。更新・削除の口は持たない(DB 側のトリガーでも拒否する)。 */
@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditEntry entry) {
    final String sql =
        """
        INSERT INTO audit_logs (
          id, actor_user_id, action, entity_type, target_id,
          before_json, after_json, context_json, created_at)
        VALUES (
          :id, :actorUserId, :action, :entityType, :targetId,
          CAST(:beforeJson AS jsonb), CAST(:afterJson AS jsonb), CAST(:contextJson AS jsonb),
          :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", entry.id())
            .addValue("actorUserId", entry.actorUserId())
            .addValue("action", entry.action().wireName())
            .addValue("entityType", entry.entityType())
            .addValue("targetId", entry.targetId())
            .addValue("beforeJson", entry.beforeJson())
            .addValue("afterJson", entry.afterJson())
            .addValue("contextJson", entry.contextJson())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(entry.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<AuditEntry> findByTarget(String entityType, String targetId) {
    final String sql =
        """
        SELECT id, actor_user_id, action, entity_type, target_id,
               before_json::text AS before_json, after_json::text AS after_json,
               context_json::text AS context_json, created_at
        FROM audit_logs
        WHERE entity_type = :entityType
          AND target_id = :targetId
        ORDER BY created_at ASC, id ASC
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource()
            .addValue("entityType", entityType)
            .addValue("targetId", targetId),
        this::mapRow);
  }

  private AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditEntry(
        rs.getString("id"),
        rs.getString("actor_user_id"),
        AuditAction.fromWireName(rs.getString("action")),
        rs.getString("entity_type"),
        rs.getString("target_id"),
        rs.getString("before_json"),
        rs.getString("after_json"),
        rs.getString("context_json"),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("created_at")));
  }
}
