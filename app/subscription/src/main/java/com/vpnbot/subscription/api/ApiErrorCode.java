package com.vpnbot.subscription.api;

import org.springframework.http.HttpStatus;

/** API エラーコードと HTTP ステータスの対応。コード文字列はクライアントとの契約。 */
public enum ApiErrorCode {
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
  ALREADY_EXISTS(HttpStatus.CONFLICT),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  CONFLICT(HttpStatus.CONFLICT),
  UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
  INTERNAL_ERROR(HttpStatus.BAD_GATEWAY);

  private final HttpStatus status;

  ApiErrorCode(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
