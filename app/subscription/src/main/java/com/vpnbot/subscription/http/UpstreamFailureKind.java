package com.vpnbot.subscription.http;

/** パネル呼び出し失敗の分類。リトライ可否とブレーカー計上の判定に使う。 */
public enum UpstreamFailureKind {
  TRANSIENT_NETWORK,
  TIMEOUT,
  SERVER_ERROR,
  UNAUTHORIZED,
  AUTHENTICATION,
  CLIENT_ERROR,
  INVALID_RESPONSE,
  CIRCUIT_OPEN
}
