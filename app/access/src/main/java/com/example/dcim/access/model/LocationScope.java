/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/LocationScope.java
 * 何を: Principal が参照できるロケーションの範囲
 * なぜ: 一覧/詳細クエリ側で絞り込み条件として渡せる形にするため
 */
package com.example.dcim.access.model;

import java.util.Set;

public record LocationScope(boolean unrestricted, Set<Long> locationIds) {

  public LocationScope {
    locationIds = locationIds == null ? Set.of() : Set.copyOf(locationIds);
    if (!unrestricted && locationIds.isEmpty()) {
      throw new IllegalArgumentException("restricted scope needs at least one location");
    }
  }

  public static LocationScope unrestrictedScope() {
    return new LocationScope(true, Set.of());
  }

  public static LocationScope restrictedTo(Set<Long> locationIds) {
    return new LocationScope(false, locationIds);
  }

  public boolean permits(long locationId) {
    return unrestricted || locationIds.contains(locationId);
  }
}
