/*
 * どこで: Subscription HTTP 層
 * 何を: パネル呼び出しの最終失敗を分類付きで表現する
 * なぜ: 上位のパネルクライアントがドメインエラーへ一貫変換できるようにするため
 */
package com.vpnbot.subscription.http;

public class UpstreamCallException extends RuntimeException {

  private static final int NO_STATUS = 0;

  private final UpstreamFailureKind kind;
  private final int statusCode;

  public UpstreamCallException(UpstreamFailureKind kind, String message) {
    this(kind, NO_STATUS, message, null);
  }

  public UpstreamCallException(UpstreamFailureKind kind, String message, Throwable cause) {
    this(kind, NO_STATUS, message, cause);
  }

  public UpstreamCallException(
      UpstreamFailureKind kind, int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public UpstreamFailureKind kind() {
    return kind;
  }

  /** HTTP 応答を受け取った失敗なら status、通信失敗なら 0。 */
  public int statusCode() {
    return statusCode;
  }

  public boolean hasStatus(int status) {
    return statusCode == status;
  }
}
