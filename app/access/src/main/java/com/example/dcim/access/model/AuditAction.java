package com.example.dcim.access.model;

import java.util.Locale;

public enum AuditAction {
  CREATE,
  UPDATE,
  DELETE;

  /** audit_logs.action に保存する値 (create/update/delete)。 */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AuditAction fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("audit action is required");
    }
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
