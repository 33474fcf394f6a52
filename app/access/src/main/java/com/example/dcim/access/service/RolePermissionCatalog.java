/*
 * どこで: Access サービス層
 * 何を: ロール名 -> 権限集合 (継承を平坦化済み) のスナップショットを保持する
 * なぜ: リクエスト時に継承チェーンを辿らず、再読込時は 1 回の参照入れ替えで切り替えるため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.RoleDefinition;
import com.example.dcim.access.model.RoleNames;
import com.example.dcim.access.repository.RoleRepository;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PostConstruct;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RolePermissionCatalog {

  private static final Logger logger = LoggerFactory.getLogger(RolePermissionCatalog.class);

  private final RoleRepository roleRepository;
  private final AtomicReference<Snapshot> snapshot =
      new AtomicReference<>(new Snapshot(Map.of(), 0L));

  public RolePermissionCatalog(RoleRepository roleRepository) {
    this.roleRepository = roleRepository;
  }

  @PostConstruct
  public void reload() {
    final Map<String, Set<Permission>> flattened = flatten(roleRepository.findRoleDefinitions());
    final Snapshot next =
        snapshot.updateAndGet(previous -> new Snapshot(flattened, previous.epoch() + 1));
    logger.info("role catalog loaded roles={} epoch={}", flattened.keySet(), next.epoch());
  }

  /** 未知のロールは何も与えない。 */
  public Set<Permission> permissionsOf(Collection<String> roleNames) {
    final Map<String, Set<Permission>> current = snapshot.get().permissionsByRole();
    final Set<Permission> permissions = EnumSet.noneOf(Permission.class);
    for (String roleName : RoleNames.normalizeAll(roleNames)) {
      permissions.addAll(current.getOrDefault(roleName, Set.of()));
    }
    return Set.copyOf(permissions);
  }

  public long epoch() {
    return snapshot.get().epoch();
  }

  @VisibleForTesting
  static Map<String, Set<Permission>> flatten(Collection<RoleDefinition> definitions) {
    final Map<String, RoleDefinition> byName = new HashMap<>();
    for (RoleDefinition definition : definitions) {
      byName.put(definition.name(), definition);
    }
    final Map<String, Set<Permission>> flattened = new HashMap<>();
    for (String roleName : byName.keySet()) {
      final Set<Permission> permissions = EnumSet.noneOf(Permission.class);
      collect(roleName, byName, new HashSet<>(), permissions);
      flattened.put(roleName, Set.copyOf(permissions));
    }
    return Map.copyOf(flattened);
  }

  private static void collect(
      String roleName,
      Map<String, RoleDefinition> byName,
      Set<String> visited,
      Set<Permission> permissions) {
    // 循環した親子関係は 1 度ずつだけ辿る
    if (!visited.add(roleName)) {
      return;
    }
    final RoleDefinition definition = byName.get(roleName);
    if (definition == null) {
      // 無効化された親ロールは何も与えない
      return;
    }
    permissions.addAll(definition.permissions());
    for (String parent : definition.parents()) {
      collect(parent, byName, visited, permissions);
    }
  }

  private record Snapshot(Map<String, Set<Permission>> permissionsByRole, long epoch) {}
}
