/*
 * どこで: Access サービス補助
 * 何を: refresh token の台帳キー (SHA-256 hex) を生成する
 * なぜ: DB 漏えい時にトークン本体を再利用されないようにするため
 */
package com.example.dcim.access.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class RefreshTokenHasher {

  public String hash(String token) {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("token is required");
    }
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
