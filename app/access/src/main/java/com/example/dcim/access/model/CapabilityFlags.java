/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/CapabilityFlags.java
 * 何を: ログイン応答に載せる編集/削除/参照フラグ
 * なぜ: クライアントが権限集合を解釈せずに画面を出し分けられるようにするため
 */
package com.example.dcim.access.model;

import java.util.Set;

public record CapabilityFlags(boolean editable, boolean deletable, boolean viewer) {

  public static CapabilityFlags from(Set<Permission> permissions) {
    return new CapabilityFlags(
        permissions.contains(Permission.DEVICE_UPDATE),
        permissions.contains(Permission.DEVICE_DELETE),
        permissions.contains(Permission.DEVICE_VIEW));
  }
}
