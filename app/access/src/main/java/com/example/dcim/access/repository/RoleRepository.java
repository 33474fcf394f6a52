package com.example.dcim.access.repository;

import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.RoleDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class RoleRepository {

  private static final Logger logger = LoggerFactory.getLogger(RoleRepository.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 有効なロールだけを、直接付与された権限と親ロール名つきで返す。3 つの読み取りは同じスナップショットで行い、
   * 最初の一覧に無いロールの行は無視する。
   */
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public List<RoleDefinition> findRoleDefinitions() {
    final List<String> roleNames =
        jdbcTemplate.query(
            """
            SELECT name
            FROM roles
            WHERE active = TRUE
            ORDER BY name ASC
            """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> rs.getString("name"));

    final Map<String, Set<Permission>> permissionsByRole = new LinkedHashMap<>();
    final Map<String, Set<String>> parentsByRole = new LinkedHashMap<>();
    for (String roleName : roleNames) {
      permissionsByRole.put(roleName, new LinkedHashSet<>());
      parentsByRole.put(roleName, new LinkedHashSet<>());
    }

    jdbcTemplate.query(
        """
        SELECT rp.role_name, rp.permission
        FROM role_permissions rp
        JOIN roles r ON r.name = rp.role_name
        WHERE r.active = TRUE
        ORDER BY rp.role_name ASC, rp.permission ASC
        """,
        new MapSqlParameterSource(),
        rs -> {
          final String roleName = rs.getString("role_name");
          final Set<Permission> permissions = permissionsByRole.get(roleName);
          if (permissions == null) {
            logger.debug("permission row for unlisted role skipped role={}", roleName);
            return;
          }
          final String wireName = rs.getString("permission");
          final Optional<Permission> permission = Permission.fromWireName(wireName);
          if (permission.isEmpty()) {
            logger.warn("unknown permission skipped role={} permission={}", roleName, wireName);
            return;
          }
          permissions.add(permission.get());
        });

    jdbcTemplate.query(
        """
        SELECT rh.role_name, rh.parent_name
        FROM role_parents rh
        JOIN roles r ON r.name = rh.role_name
        WHERE r.active = TRUE
        ORDER BY rh.role_name ASC, rh.parent_name ASC
        """,
        new MapSqlParameterSource(),
        rs -> {
          final Set<String> parents = parentsByRole.get(rs.getString("role_name"));
          if (parents != null) {
            parents.add(rs.getString("parent_name"));
          }
        });

    final List<RoleDefinition> definitions = new ArrayList<>(roleNames.size());
    for (String roleName : roleNames) {
      definitions.add(
          new RoleDefinition(
              roleName, permissionsByRole.get(roleName), parentsByRole.get(roleName)));
    }
    return definitions;
  }
}
