/*
 * どこで: app/access/src/main/java/com/example/dcim/access/model/AccountStatus.java
 * 何を: Principal の利用状態を表す列挙型
 * なぜ: ログイン可否とリフレッシュ可否を状態で一貫して判定するため
 */
package com.example.dcim.access.model;

public enum AccountStatus {
  ACTIVE,
  DISABLED
}
