package com.example.dcim.access.service;

/** 資格情報またはトークンが受け入れられなかったことを表す。 */
public class AuthenticationException extends RuntimeException {

  private final AccessErrorCode code;

  public AuthenticationException(AccessErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public AuthenticationException(AccessErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public AccessErrorCode code() {
    return code;
  }
}
