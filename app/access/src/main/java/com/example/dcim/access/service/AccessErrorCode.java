/*
 * どこで: Access サービス層
 * 何を: 認証・認可・監査で返すエラー種別
 * なぜ: ルーター側で HTTP ステータスへ一貫変換するため
 */
package com.example.dcim.access.service;

public enum AccessErrorCode {
  INVALID_CREDENTIALS(401),
  ACCOUNT_DISABLED(403),
  INVALID_SIGNATURE(401),
  // 期限切れはクライアントに refresh を促すため 401 と区別する
  TOKEN_EXPIRED(419),
  MALFORMED_TOKEN(401),
  UNAUTHENTICATED(401),
  FORBIDDEN(403),
  STORAGE_ERROR(500);

  private final int httpStatus;

  AccessErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
