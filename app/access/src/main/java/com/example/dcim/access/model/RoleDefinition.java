/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/RoleDefinition.java
 * 何を: roles / role_permissions / role_parents 相当の定義
 * なぜ: 継承を起動時に平坦化するための入力を保持するため
 */
package com.example.dcim.access.model;

import java.util.Set;

public record RoleDefinition(String name, Set<Permission> permissions, Set<String> parents) {

  public RoleDefinition {
    name = RoleNames.normalize(name);
    if (name == null) {
      throw new IllegalArgumentException("role name is required");
    }
    permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    parents = RoleNames.normalizeAll(parents);
  }
}
