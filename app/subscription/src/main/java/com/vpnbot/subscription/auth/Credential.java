package com.vpnbot.subscription.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * パネル管理者トークンのスナップショット。
 *
 * <p>{@code expiresAt} が null の場合は発行時刻 + フォールバック TTL を期限とみなす。
 */
public record Credential(String token, Instant issuedAt, Instant expiresAt) {

  public Credential {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(issuedAt, "issuedAt");
  }

  public boolean isUsableAt(Instant now, Duration fallbackTtl, Duration refreshSkew) {
    final Instant expiry = expiresAt != null ? expiresAt : issuedAt.plus(fallbackTtl);
    return now.isBefore(expiry.minus(refreshSkew));
  }

  public String authorizationHeaderValue() {
    return "Bearer " + token;
  }

  @Override
  public String toString() {
    return "Credential[token=***, issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
  }
}
