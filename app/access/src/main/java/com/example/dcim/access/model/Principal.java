/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/Principal.java
 * 何を: 認証済み、または認証対象のユーザーを表すドメインレコード
 * なぜ: 資格情報(ハッシュ)と分離し、トークン発行と認可にだけ必要な属性を渡すため
 */
package com.example.dcim.access.model;

import java.util.List;
import java.util.Set;

public record Principal(String principalId, Set<String> roles, AccountStatus status) {

  public Principal {
    if (principalId == null || principalId.isBlank()) {
      throw new IllegalArgumentException("principal_id is required");
    }
    roles = RoleNames.normalizeAll(roles);
    status = status == null ? AccountStatus.DISABLED : status;
  }

  public boolean isActive() {
    return status == AccountStatus.ACTIVE;
  }

  public List<String> sortedRoles() {
    return roles.stream().sorted().toList();
  }
}
