/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/AuditEntry.java
 * 何を: audit_logs テーブル相当のドメインレコード
 * なぜ: 変更操作の実行者・対象・前後状態を追跡可能にするため
 */
package com.example.dcim.access.model;

import java.time.Instant;

public record AuditEntry(
    String id,
    String actorUserId,
    AuditAction action,
    String entityType,
    String targetId,
    String beforeJson,
    String afterJson,
    String contextJson,
    Instant createdAt) {}
