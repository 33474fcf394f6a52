/*
 * どこで: Access サービス層
 * 何を: 変更操作 1 件につき 1 件の監査ログを組み立てて保存する
 * なぜ: 誰が・何を・どう変えたかを前後スナップショット付きで残すため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.model.AuditAction;
import com.example.dcim.access.model.AuditEntry;
import com.example.dcim.access.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditRecorder {

  private static final Logger logger = LoggerFactory.getLogger(AuditRecorder.class);

  private final AuditLogRepository auditLogRepository;
  private final AccessMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AuditEntry record(
      String actorUserId,
      AuditAction action,
      String entityType,
      String targetId,
      Object before,
      Object after) {
    return record(actorUserId, action, entityType, targetId, before, after, Map.of());
  }

  public AuditEntry record(
      String actorUserId,
      AuditAction action,
      String entityType,
      String targetId,
      Object before,
      Object after,
      Map<String, Object> context) {
    if (actorUserId == null || actorUserId.isBlank()) {
      throw new IllegalArgumentException("actor_user_id is required");
    }
    if (action == null) {
      throw new IllegalArgumentException("action is required");
    }
    if (entityType == null || entityType.isBlank()) {
      throw new IllegalArgumentException("entity_type is required");
    }
    if (targetId == null || targetId.isBlank()) {
      throw new IllegalArgumentException("target_id is required");
    }
    validateShape(action, before, after);

    final AuditEntry entry =
        new AuditEntry(
            UUID.randomUUID().toString(),
            actorUserId,
            action,
            entityType,
            targetId,
            toJson(before),
            toJson(after),
            toJson(context == null ? Map.of() : context),
            Instant.now(clock));
    try {
      auditLogRepository.insert(entry);
    } catch (DataAccessException e) {
      metrics.recordAuditWriteFailure();
      logger.error(
          "audit write failed action={} entityType={} targetId={} actor={}",
          action.wireName(),
          entityType,
          targetId,
          actorUserId,
          e);
      throw new AuditStorageException("failed to persist audit entry", e);
    }
    return entry;
  }

  // create は after のみ、update は両方、delete は before のみ
  private void validateShape(AuditAction action, Object before, Object after) {
    switch (action) {
      case CREATE -> {
        if (before != null || after == null) {
          throw new IllegalArgumentException("create audit requires after and no before");
        }
      }
      case UPDATE -> {
        if (before == null || after == null) {
          throw new IllegalArgumentException("update audit requires before and after");
        }
      }
      case DELETE -> {
        if (before == null || after != null) {
          throw new IllegalArgumentException("delete audit requires before and no after");
        }
      }
    }
  }

  private String toJson(Object snapshot) {
    if (snapshot == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize audit snapshot", e);
    }
  }
}
