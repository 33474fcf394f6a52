/*
 * どこで: Access サービス層
 * 何を: トークンのクレームと要求権限から ALLOWED / FORBIDDEN を決める
 * なぜ: 通常はトークン内のロールで判定し、設定された権限だけ最新ロールを引き直すため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.config.AccessPolicyProperties;
import com.example.dcim.access.model.AccessDecision;
import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.TokenClaims;
import java.util.Collection;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AccessEnforcer {

  private static final Logger logger = LoggerFactory.getLogger(AccessEnforcer.class);

  private final RoleResolver roleResolver;
  private final AccessPolicyProperties policy;
  private final AccessMetrics metrics;

  public AccessDecision authorize(TokenClaims claims, Permission requiredPermission) {
    if (claims == null) {
      throw new AuthenticationException(AccessErrorCode.UNAUTHENTICATED, "authentication required");
    }
    if (requiredPermission == null) {
      throw new IllegalArgumentException("required permission is required");
    }
    final boolean live = policy.requiresLiveRoleCheck(requiredPermission);
    final Collection<String> roles =
        live ? roleResolver.resolveRoles(claims.subject()) : claims.roles();
    final Set<Permission> granted = roleResolver.permissionsFor(roles);
    final AccessDecision decision =
        granted.contains(requiredPermission) ? AccessDecision.ALLOWED : AccessDecision.FORBIDDEN;
    metrics.recordDecision(decision);
    if (!decision.isAllowed()) {
      logger.info(
          "access forbidden subject={} permission={} liveRoles={}",
          claims.subject(),
          requiredPermission.wireName(),
          live);
    }
    return decision;
  }

  public void requirePermission(TokenClaims claims, Permission requiredPermission) {
    if (!authorize(claims, requiredPermission).isAllowed()) {
      throw new AccessDeniedException(
          "permission required: " + requiredPermission.wireName());
    }
  }
}
