package com.vpnbot.subscription.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<V>(V value, Instant createdAt, Duration ttl) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(createdAt.plus(ttl));
  }
}
