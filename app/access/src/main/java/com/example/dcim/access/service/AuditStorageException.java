/*
 * どこで: Access サービス層
 * 何を: 監査ログの永続化失敗を表現する
 * なぜ: 監査が残らなかった変更を呼び出し側が成功扱いしないようにするため
 */
package com.example.dcim.access.service;

public class AuditStorageException extends RuntimeException {

  public AuditStorageException(String message, Throwable cause) {
    super(message, cause);
  }

  public AccessErrorCode code() {
    return AccessErrorCode.STORAGE_ERROR;
  }
}
