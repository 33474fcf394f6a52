/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/TokenClaims.java
 * 何を: 署名済みトークンのクレーム(sub/roles/iat/exp/type)
 * なぜ: 緩い Map ではなく必須項目が揃った固定レコードとして扱うため
 */
package com.example.dcim.access.model;

import java.time.Instant;
import java.util.List;

public record TokenClaims(
    String subject, List<String> roles, Instant issuedAt, Instant expiresAt, TokenType type) {

  public TokenClaims {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject is required");
    }
    if (issuedAt == null || expiresAt == null) {
      throw new IllegalArgumentException("issued_at and expires_at are required");
    }
    if (!expiresAt.isAfter(issuedAt)) {
      throw new IllegalArgumentException("expires_at must be after issued_at");
    }
    if (type == null) {
      throw new IllegalArgumentException("token type is required");
    }
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
