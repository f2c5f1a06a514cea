/*
 * どこで: Subscription パネル連携層
 * 何を: パネル API 呼び出しの失敗をドメイン向けの理由付きで表現する
 * なぜ: サービス層と API 層が通信詳細に依存せず一貫して扱えるようにするため
 */
package com.vpnbot.subscription.panel;

public class PanelIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    CONFLICT,
    UPSTREAM_UNAVAILABLE,
    INVALID_UPSTREAM_RESPONSE
  }

  private final Reason reason;

  public PanelIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PanelIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
