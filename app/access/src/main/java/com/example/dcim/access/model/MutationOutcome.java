package com.example.dcim.access.model;

/**
 * Result of a mutation run together with its audit write. A success always carries the audit
 * entry that was committed with it; a failure never does.
 */
public record MutationOutcome<T>(
    T newState, AuditEntry auditEntry, String failureReason, Throwable failureCause) {

  public static <T> MutationOutcome<T> success(T newState, AuditEntry auditEntry) {
    if (auditEntry == null) {
      throw new IllegalArgumentException("successful mutation requires an audit entry");
    }
    return new MutationOutcome<>(newState, auditEntry, null, null);
  }

  public static <T> MutationOutcome<T> failure(String reason, Throwable cause) {
    return new MutationOutcome<>(null, null, reason == null ? "mutation failed" : reason, cause);
  }

  public boolean succeeded() {
    return failureReason == null;
  }
}
