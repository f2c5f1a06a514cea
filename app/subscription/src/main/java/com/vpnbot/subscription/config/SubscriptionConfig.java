/*
 * どこで: Subscription 設定
 * 何を: UTC の Clock と状態照会キャッシュを Bean として提供する
 * なぜ: トークン期限・キャッシュ TTL・購読期限を同じ時刻源で判定するため
 */
package com.vpnbot.subscription.config;

import com.vpnbot.subscription.cache.TtlCache;
import com.vpnbot.subscription.model.SubscriptionStatusView;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SubscriptionProperties.class, SubscriptionCacheProperties.class})
public class SubscriptionConfig {

  static final String STATUS_CACHE_NAME = "subscription-status";

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  TtlCache<Long, SubscriptionStatusView> subscriptionStatusCache(Clock clock) {
    return new TtlCache<>(STATUS_CACHE_NAME, clock);
  }
}
