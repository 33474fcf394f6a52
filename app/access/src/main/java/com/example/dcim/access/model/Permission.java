/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/Permission.java
 * 何を: DCIM 操作に必要な権限の閉じた集合
 * なぜ: 権限チェックを文字列パターンではなく完全一致で行うため
 */
package com.example.dcim.access.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum Permission {
  DEVICE_VIEW("device.view"),
  DEVICE_CREATE("device.create"),
  DEVICE_UPDATE("device.update"),
  DEVICE_DELETE("device.delete"),
  RACK_VIEW("rack.view"),
  RACK_CREATE("rack.create"),
  RACK_UPDATE("rack.update"),
  RACK_DELETE("rack.delete"),
  LOCATION_VIEW("location.view"),
  LOCATION_CREATE("location.create"),
  LOCATION_UPDATE("location.update"),
  LOCATION_DELETE("location.delete"),
  LOCATION_ALL("location.all"),
  CHANGE_LOG_VIEW("change_log.view"),
  DATA_EXPORT("data.export"),
  BULK_UPLOAD("bulk.upload"),
  NETWORK_RESET("network.reset");

  private static final Map<String, Permission> BY_WIRE_NAME =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(Permission::wireName, Function.identity()));

  private final String wireName;

  Permission(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** Exact, case-sensitive lookup by wire name such as {@code device.create}. */
  public static Optional<Permission> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }
}
