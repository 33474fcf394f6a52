/*
 * どこで: Access サービス層
 * 何を: HS256 署名付きトークンの発行と検証
 * なぜ: 署名 -> 期限 -> 構造の順で検証し、改ざんを期限切れより先に検出するため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.config.AccessTokenProperties;
import com.example.dcim.access.model.IssuedToken;
import com.example.dcim.access.model.Principal;
import com.example.dcim.access.model.TokenClaims;
import com.example.dcim.access.model.TokenType;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TokenIssuer {

  private static final Logger logger = LoggerFactory.getLogger(TokenIssuer.class);

  static final String CLAIM_SUBJECT = "sub";
  static final String CLAIM_ROLES = "roles";
  static final String CLAIM_ISSUED_AT = "iat";
  static final String CLAIM_EXPIRES_AT = "exp";
  static final String CLAIM_TYPE = "type";

  private static final Set<String> CLAIM_NAMES =
      Set.of(CLAIM_SUBJECT, CLAIM_ROLES, CLAIM_ISSUED_AT, CLAIM_EXPIRES_AT, CLAIM_TYPE);

  private final SigningKeyHolder signingKeyHolder;
  private final AccessTokenProperties properties;
  private final AccessMetrics metrics;
  private final Clock clock;

  public IssuedToken issue(Principal principal, TokenType type) {
    if (principal == null) {
      throw new IllegalArgumentException("principal is required");
    }
    if (type == null) {
      throw new IllegalArgumentException("token type is required");
    }
    // iat/exp は秒精度で載るため、発行時点で切り捨てて返却値とトークンを一致させる
    final Instant issuedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
    final Instant expiresAt = issuedAt.plus(properties.ttlFor(type));
    final TokenClaims claims =
        new TokenClaims(
            principal.principalId(), principal.sortedRoles(), issuedAt, expiresAt, type);

    final JWTClaimsSet claimsSet =
        new JWTClaimsSet.Builder()
            .subject(claims.subject())
            .claim(CLAIM_ROLES, claims.roles())
            .issueTime(Date.from(issuedAt))
            .expirationTime(Date.from(expiresAt))
            .claim(CLAIM_TYPE, type.claimValue())
            .build();
    final SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claimsSet);
    try {
      jwt.sign(signingKeyHolder.current().signer());
    } catch (JOSEException e) {
      throw new IllegalStateException("failed to sign token", e);
    }
    return new IssuedToken(jwt.serialize(), claims);
  }

  public TokenClaims decode(String token) {
    if (token == null || token.isBlank()) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token is required");
    }

    final SignedJWT jwt;
    try {
      jwt = SignedJWT.parse(token);
    } catch (ParseException e) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token is not a signed JWT");
    }

    if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
      throw reject(AccessErrorCode.INVALID_SIGNATURE, "unexpected signing algorithm");
    }
    if (!verifySignature(jwt)) {
      throw reject(AccessErrorCode.INVALID_SIGNATURE, "token signature mismatch");
    }

    final JWTClaimsSet claimsSet;
    try {
      claimsSet = jwt.getJWTClaimsSet();
    } catch (ParseException e) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token payload is not valid claims");
    }

    final Date expiration = claimsSet.getExpirationTime();
    if (expiration != null && Instant.now(clock).isAfter(expiration.toInstant())) {
      throw reject(AccessErrorCode.TOKEN_EXPIRED, "token expired");
    }

    return toClaims(claimsSet);
  }

  private boolean verifySignature(SignedJWT jwt) {
    try {
      return jwt.verify(signingKeyHolder.current().verifier());
    } catch (JOSEException e) {
      logger.debug("token signature verification failed", e);
      return false;
    }
  }

  private TokenClaims toClaims(JWTClaimsSet claimsSet) {
    if (!claimsSet.getClaims().keySet().equals(CLAIM_NAMES)) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token claims are not the expected set");
    }
    final String subject = claimsSet.getSubject();
    if (subject == null || subject.isBlank()) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token subject is missing");
    }
    final Optional<TokenType> type =
        claimsSet.getClaim(CLAIM_TYPE) instanceof String value
            ? TokenType.fromClaimValue(value)
            : Optional.empty();
    if (type.isEmpty()) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token type is unknown");
    }
    final Date issuedAt = claimsSet.getIssueTime();
    final Date expiresAt = claimsSet.getExpirationTime();
    if (issuedAt == null || expiresAt == null || !expiresAt.after(issuedAt)) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token timestamps are inconsistent");
    }
    return new TokenClaims(
        subject,
        readRoles(claimsSet.getClaim(CLAIM_ROLES)),
        issuedAt.toInstant(),
        expiresAt.toInstant(),
        type.get());
  }

  private List<String> readRoles(Object rawRoles) {
    if (!(rawRoles instanceof List<?> values)) {
      throw reject(AccessErrorCode.MALFORMED_TOKEN, "token roles must be a list");
    }
    final List<String> roles = new ArrayList<>(values.size());
    for (Object value : values) {
      if (!(value instanceof String role)) {
        throw reject(AccessErrorCode.MALFORMED_TOKEN, "token roles must be strings");
      }
      roles.add(role);
    }
    return roles;
  }

  private AuthenticationException reject(AccessErrorCode code, String message) {
    metrics.recordTokenRejected(code);
    return new AuthenticationException(code, message);
  }
}
