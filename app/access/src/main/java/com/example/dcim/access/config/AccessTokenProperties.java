/*
 * どこで: Access アプリの設定バインド
 * 何を: トークン TTL (access/refresh) と署名鍵を保持する
 * なぜ: 環境変数 ACCESS_TOKEN_TTL_SECONDS / REFRESH_TOKEN_TTL_SECONDS / SIGNING_KEY を起動時に検証するため
 */
package com.example.dcim.access.config;

import com.example.dcim.access.model.TokenType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "access.token")
@Validated
public record AccessTokenProperties(
    @NotNull @Positive Long accessTokenTtlSeconds,
    @NotNull @Positive Long refreshTokenTtlSeconds,
    @NotBlank String signingKey) {

  // HS256 は 256bit 以上の鍵を要求する
  public static final int MIN_SIGNING_KEY_BYTES = 32;

  @AssertTrue(message = "access.token.signing-key must be at least 32 bytes")
  public boolean isSigningKeyLongEnough() {
    // null/blank は @NotBlank で検出する前提。
    return signingKey == null
        || signingKey.getBytes(StandardCharsets.UTF_8).length >= MIN_SIGNING_KEY_BYTES;
  }

  @AssertTrue(message = "access.token.refresh-token-ttl-seconds must exceed the access token TTL")
  public boolean isRefreshTtlLongerThanAccessTtl() {
    return accessTokenTtlSeconds == null
        || refreshTokenTtlSeconds == null
        || refreshTokenTtlSeconds > accessTokenTtlSeconds;
  }

  public Duration ttlFor(TokenType type) {
    return switch (type) {
      case ACCESS -> Duration.ofSeconds(accessTokenTtlSeconds);
      case REFRESH -> Duration.ofSeconds(refreshTokenTtlSeconds);
    };
  }

  @Override
  public String toString() {
    return "AccessTokenProperties[accessTokenTtlSeconds="
        + accessTokenTtlSeconds
        + ", refreshTokenTtlSeconds="
        + refreshTokenTtlSeconds
        + ", signingKey=***]";
  }
}
