/*
 * どこで: Access サービス層
 * 何を: トークン署名に使う HMAC 鍵をプロセス全体で 1 つ保持する
 * なぜ: 鍵の差し替えを 1 回の参照入れ替えで行い、署名と検証が常に同じ鍵を見るようにするため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.config.AccessTokenProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SigningKeyHolder {

  private static final Logger logger = LoggerFactory.getLogger(SigningKeyHolder.class);

  private final AtomicReference<KeyMaterial> current = new AtomicReference<>();

  public SigningKeyHolder(AccessTokenProperties properties) {
    current.set(KeyMaterial.of(properties.signingKey()));
    logger.info("signing key loaded fingerprint={}", current.get().fingerprint());
  }

  public KeyMaterial current() {
    return current.get();
  }

  /** 以後の発行・検証は新しい鍵で行う。旧鍵で署名されたトークンは INVALID_SIGNATURE になる。 */
  public void rotate(String newSecret) {
    final KeyMaterial next = KeyMaterial.of(newSecret);
    final KeyMaterial previous = current.getAndSet(next);
    logger.info(
        "signing key rotated previousFingerprint={} fingerprint={}",
        previous.fingerprint(),
        next.fingerprint());
  }

  public record KeyMaterial(JWSSigner signer, JWSVerifier verifier, String fingerprint) {

    static KeyMaterial of(String secret) {
      if (secret == null || secret.isBlank()) {
        throw new IllegalArgumentException("signing key is required");
      }
      final byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
      if (keyBytes.length < AccessTokenProperties.MIN_SIGNING_KEY_BYTES) {
        throw new IllegalArgumentException(
            "signing key must be at least "
                + AccessTokenProperties.MIN_SIGNING_KEY_BYTES
                + " bytes");
      }
      try {
        return new KeyMaterial(
            new MACSigner(keyBytes), new MACVerifier(keyBytes), fingerprint(keyBytes));
      } catch (JOSEException e) {
        throw new IllegalStateException("failed to initialize signing key", e);
      }
    }

    // ログ出力用。鍵そのものは出さず SHA-256 の先頭 8 バイトだけを使う
    private static String fingerprint(byte[] keyBytes) {
      try {
        final byte[] digest = MessageDigest.getInstance("SHA-256").digest(keyBytes);
        final StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 8; i++) {
          builder.append(String.format("%02x", digest[i]));
        }
        return builder.toString();
      } catch (NoSuchAlgorithmException e) {
        throw new IllegalStateException("SHA-256 is not available", e);
      }
    }
  }
}
