package com.example.dcim.access.model;

public record IssuedToken(String value, TokenClaims claims) {

  // トークン文字列はログへ出さない
  @Override
  public String toString() {
    return "IssuedToken[type="
        + claims.type()
        + ", subject="
        + claims.subject()
        + ", expiresAt="
        + claims.expiresAt()
        + "]";
  }
}
