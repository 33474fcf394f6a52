package com.example.dcim.access.model;

import java.util.Map;

/**
 * Describes a mutation before it runs: who performs it, on what, and the state it starts from.
 * The state after the change is whatever the mutation returns.
 */
public record AuditedChange(
    String actorUserId,
    AuditAction action,
    String entityType,
    String targetId,
    Object before,
    Map<String, Object> context) {

  public AuditedChange {
    context = context == null ? Map.of() : Map.copyOf(context);
  }

  public static AuditedChange of(
      String actorUserId, AuditAction action, String entityType, String targetId, Object before) {
    return new AuditedChange(actorUserId, action, entityType, targetId, before, Map.of());
  }
}
