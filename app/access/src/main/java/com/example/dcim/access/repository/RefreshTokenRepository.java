package com.example.dcim.access.repository;

import com.example.dcim.common.JdbcTimestampUtils;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** 発行済み refresh token のハッシュ台帳。トークン本体は保存しない。 */
@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class RefreshTokenRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(String tokenHash, String principalId, Instant expiresAt, Instant createdAt) {
    final String sql =
        """
        INSERT INTO refresh_tokens (token_hash, principal_id, expires_at, created_at)
        VALUES (:tokenHash, :principalId, :expiresAt, :createdAt)
        ON CONFLICT (token_hash) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tokenHash", tokenHash)
            .addValue("principalId", principalId)
            .addValue("expiresAt", JdbcTimestampUtils.toTimestamp(expiresAt))
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public boolean existsActive(String tokenHash, Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM refresh_tokens
        WHERE token_hash = :tokenHash
          AND expires_at >= :now
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql,
            new MapSqlParameterSource()
                .addValue("tokenHash", tokenHash)
                .addValue("now", JdbcTimestampUtils.toTimestamp(now)),
            Integer.class);
    return count != null && count > 0;
  }

  public int deleteByPrincipalId(String principalId) {
    final String sql =
        """
        DELETE FROM refresh_tokens
        WHERE principal_id = :principalId
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("principalId", principalId));
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM refresh_tokens
        WHERE expires_at < :now
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("now", JdbcTimestampUtils.toTimestamp(now)));
  }
}
