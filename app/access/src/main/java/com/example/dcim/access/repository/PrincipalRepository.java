package com.example.dcim.access.repository;

import com.example.dcim.access.model.AccountStatus;
import com.example.dcim.access.model.CredentialRecord;
import com.example.dcim.access.model.Principal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class PrincipalRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CredentialRecord> findCredential(String identifier) {
    final String sql =
        """
        SELECT principal_id, password_hash
        FROM principals
        WHERE principal_id = :identifier
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("identifier", identifier);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new CredentialRecord(rs.getString("principal_id"), rs.getString("password_hash")))
        .stream()
        .findFirst();
  }

  public Optional<Principal> findByIdentifier(String identifier) {
    final String sql =
        """
        SELECT principal_id, status
        FROM principals
        WHERE principal_id = :identifier
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("identifier", identifier);
    return jdbcTemplate.query(sql, params, this::mapStatusRow).stream()
        .findFirst()
        .map(
            row ->
                new Principal(row.principalId(), findRoleNames(row.principalId()), row.status()));
  }

  /** 現在割り当てられているロール。無効化されたロールも含めて返し、権限解決側で無視する。 */
  public Set<String> findRoleNames(String principalId) {
    final String sql =
        """
        SELECT role_name
        FROM principal_roles
        WHERE principal_id = :principalId
        ORDER BY role_name ASC
        """;
    final List<String> roles =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource().addValue("principalId", principalId),
            (rs, rowNum) -> rs.getString("role_name"));
    return Set.copyOf(roles);
  }

  public List<Long> findLocationIds(String principalId) {
    final String sql =
        """
        SELECT location_id
        FROM principal_locations
        WHERE principal_id = :principalId
        ORDER BY location_id ASC
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("principalId", principalId),
        (rs, rowNum) -> rs.getLong("location_id"));
  }

  private StatusRow mapStatusRow(ResultSet rs, int rowNum) throws SQLException {
    return new StatusRow(
        rs.getString("principal_id"), AccountStatus.valueOf(rs.getString("status")));
  }

  private record StatusRow(String principalId, AccountStatus status) {}
}
