/*
 * どこで: Access サービス層
 * 何を: 識別子とパスワードを保存済みハッシュと照合し Principal を返す
 * なぜ: 未登録とパスワード不一致を外部から区別できないようにするため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.model.CredentialRecord;
import com.example.dcim.access.model.Principal;
import com.example.dcim.access.repository.PrincipalRepository;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class CredentialVerifier {

  private static final Logger logger = LoggerFactory.getLogger(CredentialVerifier.class);

  static final String INVALID_CREDENTIALS_MESSAGE = "invalid username or password";

  private final PrincipalRepository principalRepository;
  private final PasswordEncoder passwordEncoder;
  // 未登録の識別子でも同じコストの照合を行うためのハッシュ
  private final String dummyHash;

  public CredentialVerifier(
      PrincipalRepository principalRepository, PasswordEncoder passwordEncoder) {
    this.principalRepository = principalRepository;
    this.passwordEncoder = passwordEncoder;
    this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
  }

  public Principal verify(String identifier, String secret) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("identifier is required");
    }
    if (secret == null || secret.isBlank()) {
      throw new IllegalArgumentException("secret is required");
    }

    final Optional<CredentialRecord> credential = principalRepository.findCredential(identifier);
    final String storedHash = credential.map(CredentialRecord::passwordHash).orElse(dummyHash);
    final boolean matches = passwordEncoder.matches(secret, storedHash);
    if (credential.isEmpty() || !matches) {
      logger.info("credential verification failed identifier={}", identifier);
      throw new AuthenticationException(
          AccessErrorCode.INVALID_CREDENTIALS, INVALID_CREDENTIALS_MESSAGE);
    }

    final Principal principal =
        principalRepository
            .findByIdentifier(identifier)
            .orElseThrow(
                () ->
                    new AuthenticationException(
                        AccessErrorCode.INVALID_CREDENTIALS, INVALID_CREDENTIALS_MESSAGE));
    if (!principal.isActive()) {
      logger.info("login rejected for disabled principal principalId={}", principal.principalId());
      throw new AuthenticationException(AccessErrorCode.ACCOUNT_DISABLED, "account is disabled");
    }
    return principal;
  }
}
