package com.example.dcim.access.service;

import java.util.Locale;

/** Authorization ヘッダから Bearer トークンを取り出す。 */
public final class BearerTokens {

  private static final String SCHEME = "bearer";

  private BearerTokens() {}

  public static String extract(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      throw new AuthenticationException(
          AccessErrorCode.UNAUTHENTICATED, "authorization header is missing");
    }
    final String trimmed = authorizationHeader.trim();
    final int separator = trimmed.indexOf(' ');
    if (separator < 0
        || !trimmed.substring(0, separator).toLowerCase(Locale.ROOT).equals(SCHEME)) {
      throw new AuthenticationException(
          AccessErrorCode.UNAUTHENTICATED, "authorization scheme must be Bearer");
    }
    final String token = trimmed.substring(separator + 1).trim();
    if (token.isEmpty()) {
      throw new AuthenticationException(AccessErrorCode.UNAUTHENTICATED, "bearer token is missing");
    }
    return token;
  }
}
