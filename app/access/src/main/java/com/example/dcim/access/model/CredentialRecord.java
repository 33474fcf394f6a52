package com.example.dcim.access.model;

/** principals テーブルの資格情報部分。password_hash は BCrypt 形式のみ。 */
public record CredentialRecord(String principalId, String passwordHash) {

  @Override
  public String toString() {
    return "CredentialRecord[principalId=" + principalId + ", passwordHash=***]";
  }
}
