/*
 * どこで: Access アプリの設定バインド
 * 何を: 認可時にロールを都度引き直すかどうかの方針
 * なぜ: 通常はトークン内のロールスナップショットで判定し、機微な操作だけ最新ロールで判定するため
 */
package com.example.dcim.access.config;

import com.example.dcim.access.model.Permission;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "access.policy")
public record AccessPolicyProperties(
    boolean liveRoleCheck, List<String> liveRoleCheckPermissions) {

  public AccessPolicyProperties {
    liveRoleCheckPermissions =
        liveRoleCheckPermissions == null ? List.of() : List.copyOf(liveRoleCheckPermissions);
    // 未知の権限名は設定ミスなので起動時に落とす
    for (String name : liveRoleCheckPermissions) {
      if (Permission.fromWireName(name).isEmpty()) {
        throw new IllegalArgumentException(
            "access.policy.live-role-check-permissions contains unknown permission: " + name);
      }
    }
  }

  public Set<Permission> sensitivePermissions() {
    final Set<Permission> permissions = EnumSet.noneOf(Permission.class);
    for (String name : liveRoleCheckPermissions) {
      Permission.fromWireName(name).ifPresent(permissions::add);
    }
    return permissions;
  }

  public boolean requiresLiveRoleCheck(Permission permission) {
    return liveRoleCheck || sensitivePermissions().contains(permission);
  }
}
