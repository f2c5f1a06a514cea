/*
 * どこで: Subscription 設定
 * 何を: キャッシュ TTL の段階と掃除ジョブの設定を保持する
 * なぜ: 上流呼び出しの削減幅を運用で調整するため
 */
package com.vpnbot.subscription.config;

import com.vpnbot.subscription.cache.CacheTtl;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "subscription.cache")
public record SubscriptionCacheProperties(
    Duration shortTtl,
    Duration mediumTtl,
    Duration longTtl,
    boolean sweepEnabled,
    Duration sweepInterval) {

  public SubscriptionCacheProperties {
    shortTtl = shortTtl == null ? Duration.ofMinutes(5) : shortTtl;
    mediumTtl = mediumTtl == null ? Duration.ofMinutes(30) : mediumTtl;
    longTtl = longTtl == null ? Duration.ofHours(1) : longTtl;
    sweepInterval = sweepInterval == null ? Duration.ofMinutes(5) : sweepInterval;
  }

  public Duration ttlFor(CacheTtl tier) {
    return switch (tier) {
      case SHORT -> shortTtl;
      case MEDIUM -> mediumTtl;
      case LONG -> longTtl;
    };
  }
}
