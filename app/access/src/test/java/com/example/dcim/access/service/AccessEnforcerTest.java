/*
 * どこで: Access 認可テスト
 * 何を: トークン内ロールと最新ロールのどちらで判定するかと、判定結果を検証する
 * なぜ: 権限昇格/剥奪の反映タイミングが設定どおりであることを保証するため
 */
package com.example.dcim.access.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.dcim.access.config.AccessPolicyProperties;
import com.example.dcim.access.model.AccessDecision;
import com.example.dcim.access.model.AccountStatus;
import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.Principal;
import com.example.dcim.access.model.TokenClaims;
import com.example.dcim.access.model.TokenType;
import com.example.dcim.access.repository.PrincipalRepository;
import com.example.dcim.access.repository.RoleRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccessEnforcerTest {

  private static final Instant ISSUED_AT = Instant.parse("2026-03-01T09:00:00Z");

  @Mock private PrincipalRepository principalRepository;
  @Mock private RoleRepository roleRepository;

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private RoleResolver roleResolver;

  @BeforeEach
  void setUp() {
    when(roleRepository.findRoleDefinitions()).thenReturn(AccessFixtures.seededRoles());
    final RolePermissionCatalog catalog = new RolePermissionCatalog(roleRepository);
    catalog.reload();
    roleResolver = new RoleResolver(principalRepository, catalog);
  }

  @Test
  void adminMayDeleteDevicesButNotResetNetwork() {
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(false, List.of()));
    final TokenClaims alice = claims("alice", "ADMIN");

    assertThat(enforcer.authorize(alice, Permission.DEVICE_DELETE))
        .isEqualTo(AccessDecision.ALLOWED);
    assertThat(enforcer.authorize(alice, Permission.NETWORK_RESET))
        .isEqualTo(AccessDecision.FORBIDDEN);
    assertThat(
            registry.get("access.authorization.total").tag("decision", "forbidden").counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void tokenWithoutRolesIsForbidden() {
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(false, List.of()));

    assertThat(enforcer.authorize(claims("eve"), Permission.DEVICE_VIEW))
        .isEqualTo(AccessDecision.FORBIDDEN);
  }

  @Test
  void missingClaimsAreUnauthenticatedNotForbidden() {
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(false, List.of()));

    assertThatThrownBy(() -> enforcer.authorize(null, Permission.DEVICE_VIEW))
        .isInstanceOfSatisfying(
            AuthenticationException.class,
            ex -> assertThat(ex.code()).isEqualTo(AccessErrorCode.UNAUTHENTICATED));
  }

  @Test
  void snapshotRolesApplyUntilTokenIsReissued() {
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(false, List.of()));
    final TokenClaims staleViewer = claims("carol", "VIEWER");

    // 発行後に ADMIN へ昇格しても、既存トークンの判定は変わらない
    assertThat(enforcer.authorize(staleViewer, Permission.DEVICE_DELETE))
        .isEqualTo(AccessDecision.FORBIDDEN);
    assertThat(enforcer.authorize(claims("carol", "ADMIN"), Permission.DEVICE_DELETE))
        .isEqualTo(AccessDecision.ALLOWED);
    verifyNoInteractions(principalRepository);
  }

  @Test
  void liveRoleCheckUsesCurrentAssignments() {
    storedPrincipal("carol", AccountStatus.ACTIVE, "ADMIN");
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(true, List.of()));

    assertThat(enforcer.authorize(claims("carol", "VIEWER"), Permission.DEVICE_DELETE))
        .isEqualTo(AccessDecision.ALLOWED);
  }

  @Test
  void liveRoleCheckRevokesImmediatelyForSensitivePermissions() {
    storedPrincipal("mallory", AccountStatus.ACTIVE, "VIEWER");
    final AccessEnforcer enforcer =
        enforcer(new AccessPolicyProperties(false, List.of("device.delete")));
    final TokenClaims formerAdmin = claims("mallory", "ADMIN");

    assertThat(enforcer.authorize(formerAdmin, Permission.DEVICE_DELETE))
        .isEqualTo(AccessDecision.FORBIDDEN);
    // 機微でない権限はトークンのロールで判定する
    assertThat(enforcer.authorize(formerAdmin, Permission.DATA_EXPORT))
        .isEqualTo(AccessDecision.ALLOWED);
  }

  @Test
  void liveRoleCheckDeniesDisabledPrincipal() {
    storedPrincipal("mallory", AccountStatus.DISABLED, "ADMIN");
    final AccessEnforcer enforcer =
        enforcer(new AccessPolicyProperties(false, List.of("device.delete")));

    assertThat(enforcer.authorize(claims("mallory", "ADMIN"), Permission.DEVICE_DELETE))
        .isEqualTo(AccessDecision.FORBIDDEN);
  }

  @Test
  void liveRoleCheckDeniesPrincipalRemovedFromStore() {
    when(principalRepository.findByIdentifier("trent")).thenReturn(Optional.empty());
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(true, List.of()));

    assertThat(enforcer.authorize(claims("trent", "VIEWER"), Permission.DEVICE_VIEW))
        .isEqualTo(AccessDecision.FORBIDDEN);
  }

  @Test
  void decisionIsDeterministicForSameInputs() {
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(false, List.of()));
    final TokenClaims bob = claims("bob", "EDITOR");

    assertThat(enforcer.authorize(bob, Permission.DEVICE_UPDATE))
        .isEqualTo(enforcer.authorize(bob, Permission.DEVICE_UPDATE))
        .isEqualTo(AccessDecision.ALLOWED);
  }

  @Test
  void requirePermissionThrowsWhenForbidden() {
    final AccessEnforcer enforcer = enforcer(new AccessPolicyProperties(false, List.of()));

    assertThatThrownBy(
            () -> enforcer.requirePermission(claims("bob", "EDITOR"), Permission.DEVICE_DELETE))
        .isInstanceOf(AccessDeniedException.class)
        .hasMessageContaining("device.delete");
  }

  private AccessEnforcer enforcer(AccessPolicyProperties policy) {
    return new AccessEnforcer(roleResolver, policy, new AccessMetrics(registry));
  }

  private void storedPrincipal(String principalId, AccountStatus status, String... roles) {
    when(principalRepository.findByIdentifier(principalId))
        .thenReturn(Optional.of(new Principal(principalId, Set.of(roles), status)));
  }

  private static TokenClaims claims(String subject, String... roles) {
    return new TokenClaims(
        subject, List.of(roles), ISSUED_AT, ISSUED_AT.plusSeconds(900), TokenType.ACCESS);
  }
}
