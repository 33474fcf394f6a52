package com.example.dcim.access.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.dcim.access.model.AccountStatus;
import com.example.dcim.access.model.AuditAction;
import com.example.dcim.access.model.AuditEntry;
import com.example.dcim.access.model.CredentialRecord;
import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.Principal;
import com.example.dcim.access.model.RoleDefinition;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class AccessRepositoryTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> "access");
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "access");
    registry.add("spring.flyway.schemas", () -> "access");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_access");
  }

  @Autowired private PrincipalRepository principalRepository;
  @Autowired private RoleRepository roleRepository;
  @Autowired private RefreshTokenRepository refreshTokenRepository;
  @Autowired private AuditLogRepository auditLogRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    // audit_logs は DELETE をトリガーで拒否するため TRUNCATE で消す
    jdbcTemplate.update("TRUNCATE access.audit_logs", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM access.principals", new MapSqlParameterSource());
    jdbcTemplate.update(
        "DELETE FROM access.roles WHERE name NOT IN ('VIEWER', 'EDITOR', 'ADMIN')",
        new MapSqlParameterSource());
  }

  @Test
  void findsCredentialAndPrincipalWithRoles() {
    insertPrincipal("alice", "ACTIVE");
    assignRole("alice", "ADMIN");
    assignRole("alice", "VIEWER");

    final Optional<CredentialRecord> credential = principalRepository.findCredential("alice");
    final Optional<Principal> principal = principalRepository.findByIdentifier("alice");

    assertThat(credential).isPresent();
    assertThat(credential.get().passwordHash()).startsWith("$2a$");
    assertThat(principal).isPresent();
    assertThat(principal.get().sortedRoles()).containsExactly("ADMIN", "VIEWER");
    assertThat(principal.get().status()).isEqualTo(AccountStatus.ACTIVE);
    assertThat(principalRepository.findByIdentifier("nobody")).isEmpty();
    assertThat(principalRepository.findCredential("nobody")).isEmpty();
  }

  @Test
  void roleNamesReflectCurrentAssignments() {
    insertPrincipal("bob", "ACTIVE");
    assignRole("bob", "EDITOR");
    assertThat(principalRepository.findRoleNames("bob")).containsExactly("EDITOR");

    jdbcTemplate.update(
        "DELETE FROM access.principal_roles WHERE principal_id = 'bob'",
        new MapSqlParameterSource());

    assertThat(principalRepository.findRoleNames("bob")).isEmpty();
  }

  @Test
  void findsAssignedLocations() {
    insertPrincipal("bob", "ACTIVE");
    jdbcTemplate.update(
        "INSERT INTO access.principal_locations (principal_id, location_id) VALUES ('bob', 5),"
            + " ('bob', 2)",
        new MapSqlParameterSource());

    assertThat(principalRepository.findLocationIds("bob")).containsExactly(2L, 5L);
  }

  @Test
  void seededRolesCarryParentsAndSkipInactiveOrUnknown() {
    jdbcTemplate.update(
        "INSERT INTO access.roles (name, active) VALUES ('RETIRED', FALSE), ('AUDITOR', TRUE)",
        new MapSqlParameterSource());
    jdbcTemplate.update(
        "INSERT INTO access.role_permissions (role_name, permission) VALUES"
            + " ('AUDITOR', 'change_log.view'), ('AUDITOR', 'device.*')",
        new MapSqlParameterSource());

    final Map<String, RoleDefinition> roles =
        roleRepository.findRoleDefinitions().stream()
            .collect(Collectors.toMap(RoleDefinition::name, Function.identity()));

    assertThat(roles).containsOnlyKeys("VIEWER", "EDITOR", "ADMIN", "AUDITOR");
    assertThat(roles.get("ADMIN").parents()).containsExactly("EDITOR");
    assertThat(roles.get("ADMIN").permissions())
        .contains(Permission.DEVICE_DELETE, Permission.LOCATION_ALL)
        .doesNotContain(Permission.NETWORK_RESET);
    assertThat(roles.get("AUDITOR").permissions()).containsExactly(Permission.CHANGE_LOG_VIEW);
  }

  @Test
  void refreshTokenLedgerLifecycle() {
    insertPrincipal("carol", "ACTIVE");
    final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    refreshTokenRepository.insert("a".repeat(64), "carol", now.plusSeconds(3600), now);
    refreshTokenRepository.insert("b".repeat(64), "carol", now.minusSeconds(1), now);

    assertThat(refreshTokenRepository.existsActive("a".repeat(64), now)).isTrue();
    assertThat(refreshTokenRepository.existsActive("b".repeat(64), now)).isFalse();
    assertThat(refreshTokenRepository.deleteExpired(now)).isEqualTo(1);
    assertThat(refreshTokenRepository.deleteByPrincipalId("carol")).isEqualTo(1);
    assertThat(refreshTokenRepository.existsActive("a".repeat(64), now)).isFalse();
  }

  @Test
  void auditLogIsAppendOnly() {
    final Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final AuditEntry entry =
        new AuditEntry(
            "audit-1",
            "bob",
            AuditAction.UPDATE,
            "device",
            "42",
            "{\"status\":\"active\"}",
            "{\"status\":\"maintenance\"}",
            "{}",
            createdAt);
    auditLogRepository.insert(entry);

    final List<AuditEntry> stored = auditLogRepository.findByTarget("device", "42");
    assertThat(stored).hasSize(1);
    assertThat(stored.get(0).action()).isEqualTo(AuditAction.UPDATE);
    assertThat(stored.get(0).afterJson()).contains("maintenance");
    assertThat(stored.get(0).createdAt()).isEqualTo(createdAt);

    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "UPDATE access.audit_logs SET actor_user_id = 'mallory'",
                    new MapSqlParameterSource()))
        .isInstanceOf(DataAccessException.class);
    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "DELETE FROM access.audit_logs", new MapSqlParameterSource()))
        .isInstanceOf(DataAccessException.class);
  }

  private void insertPrincipal(String principalId, String status) {
    jdbcTemplate.update(
        "INSERT INTO access.principals (principal_id, password_hash, status)"
            + " VALUES (:id, :hash, :status)",
        new MapSqlParameterSource()
            .addValue("id", principalId)
            .addValue("hash", "$2a$04$abcdefghijklmnopqrstuuJ0Xrr8s8.mE7HjvZKpgmlYJsGQ3NVdu")
            .addValue("status", status));
  }

  private void assignRole(String principalId, String roleName) {
    jdbcTemplate.update(
        "INSERT INTO access.principal_roles (principal_id, role_name) VALUES (:id, :role)",
        new MapSqlParameterSource().addValue("id", principalId).addValue("role", roleName));
  }
}
