/*
 * どこで: Access サービス層
 * 何を: ルーターから呼ばれる認証・認可・監査の入口
 * なぜ: ログイン/更新/ログアウト、リクエスト認証、権限判定、変更記録を 1 つの API にまとめるため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.model.AuditAction;
import com.example.dcim.access.model.AuditEntry;
import com.example.dcim.access.model.AuditedChange;
import com.example.dcim.access.model.CapabilityFlags;
import com.example.dcim.access.model.IssuedToken;
import com.example.dcim.access.model.LoginResult;
import com.example.dcim.access.model.MutationOutcome;
import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.Principal;
import com.example.dcim.access.model.TokenClaims;
import com.example.dcim.access.model.TokenPair;
import com.example.dcim.access.model.TokenType;
import com.example.dcim.access.repository.PrincipalRepository;
import com.example.dcim.access.repository.RefreshTokenRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AccessService {

  private static final Logger logger = LoggerFactory.getLogger(AccessService.class);
  static final String USER_ID_MDC_KEY = "user_id";

  private final CredentialVerifier credentialVerifier;
  private final TokenIssuer tokenIssuer;
  private final RoleResolver roleResolver;
  private final AccessEnforcer accessEnforcer;
  private final AuditRecorder auditRecorder;
  private final AuditedMutationExecutor auditedMutationExecutor;
  private final PrincipalRepository principalRepository;
  private final RefreshTokenRepository refreshTokenRepository;
  private final RefreshTokenHasher refreshTokenHasher;
  private final AccessMetrics metrics;
  private final Clock clock;

  public LoginResult login(String identifier, String secret) {
    final Principal principal;
    try {
      principal = credentialVerifier.verify(identifier, secret);
    } catch (AuthenticationException e) {
      metrics.recordLogin(e.code().name().toLowerCase(Locale.ROOT));
      throw e;
    }

    final IssuedToken accessToken = tokenIssuer.issue(principal, TokenType.ACCESS);
    final IssuedToken refreshToken = tokenIssuer.issue(principal, TokenType.REFRESH);
    refreshTokenRepository.insert(
        refreshTokenHasher.hash(refreshToken.value()),
        principal.principalId(),
        refreshToken.claims().expiresAt(),
        Instant.now(clock));

    metrics.recordLogin("success");
    logger.info(
        "login succeeded principalId={} roles={}",
        principal.principalId(),
        principal.sortedRoles());
    return new LoginResult(
        principal.principalId(),
        principal.sortedRoles(),
        new TokenPair(accessToken, refreshToken),
        CapabilityFlags.from(roleResolver.permissionsFor(principal.roles())));
  }

  /**
   * refresh token を新しい access token と交換する。ロールは台帳から引き直し、返す refresh token は
   * 受け取ったものと同じ。
   */
  public TokenPair refresh(String refreshToken) {
    final TokenClaims claims = tokenIssuer.decode(refreshToken);
    if (claims.type() != TokenType.REFRESH) {
      throw new AuthenticationException(AccessErrorCode.MALFORMED_TOKEN, "refresh token required");
    }
    if (!refreshTokenRepository.existsActive(
        refreshTokenHasher.hash(refreshToken), Instant.now(clock))) {
      throw new AuthenticationException(
          AccessErrorCode.UNAUTHENTICATED, "refresh token is revoked");
    }
    final Principal principal =
        principalRepository
            .findByIdentifier(claims.subject())
            .orElseThrow(
                () ->
                    new AuthenticationException(
                        AccessErrorCode.UNAUTHENTICATED, "principal no longer exists"));
    if (!principal.isActive()) {
      throw new AuthenticationException(AccessErrorCode.ACCOUNT_DISABLED, "account is disabled");
    }
    final IssuedToken accessToken = tokenIssuer.issue(principal, TokenType.ACCESS);
    return new TokenPair(accessToken, new IssuedToken(refreshToken, claims));
  }

  /** 発行済み refresh token をすべて失効させる。access token は期限まで有効なまま。 */
  public int logout(String principalId) {
    if (principalId == null || principalId.isBlank()) {
      throw new IllegalArgumentException("principal_id is required");
    }
    final int revoked = refreshTokenRepository.deleteByPrincipalId(principalId);
    logger.info("logout principalId={} revokedRefreshTokens={}", principalId, revoked);
    return revoked;
  }

  /** 認証に成功した subject をログ出力用に MDC の user_id へ入れる。失敗時は前の値を残さない。 */
  public TokenClaims authenticateRequest(String accessToken) {
    MDC.remove(USER_ID_MDC_KEY);
    if (accessToken == null || accessToken.isBlank()) {
      throw new AuthenticationException(AccessErrorCode.UNAUTHENTICATED, "access token required");
    }
    final TokenClaims claims = tokenIssuer.decode(accessToken);
    if (claims.type() != TokenType.ACCESS) {
      throw new AuthenticationException(AccessErrorCode.MALFORMED_TOKEN, "access token required");
    }
    MDC.put(USER_ID_MDC_KEY, claims.subject());
    return claims;
  }

  /** リクエスト処理の終わりに呼び、authenticateRequest が入れた MDC の値を外す。 */
  public void clearRequestContext() {
    MDC.remove(USER_ID_MDC_KEY);
  }

  public TokenClaims authenticateAuthorizationHeader(String authorizationHeader) {
    return authenticateRequest(BearerTokens.extract(authorizationHeader));
  }

  public boolean authorize(TokenClaims claims, Permission requiredPermission) {
    return accessEnforcer.authorize(claims, requiredPermission).isAllowed();
  }

  public CapabilityFlags capabilitiesFor(TokenClaims claims) {
    if (claims == null) {
      throw new AuthenticationException(AccessErrorCode.UNAUTHENTICATED, "authentication required");
    }
    return CapabilityFlags.from(roleResolver.permissionsFor(claims.roles()));
  }

  /**
   * 別トランザクションでコミット済みの変更を記録する。AuditStorageException はそのまま伝播するので、
   * 呼び出し側は変更を成功として返してはならない。
   */
  public AuditEntry logChange(
      String actorUserId,
      AuditAction action,
      String entityType,
      String targetId,
      Object before,
      Object after,
      Map<String, Object> context) {
    return auditRecorder.record(actorUserId, action, entityType, targetId, before, after, context);
  }

  public <T> MutationOutcome<T> applyChange(AuditedChange change, Supplier<T> mutation) {
    return auditedMutationExecutor.execute(change, mutation);
  }
}
