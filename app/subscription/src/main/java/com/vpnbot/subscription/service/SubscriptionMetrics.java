/*
 * どこで: Subscription サービス層
 * 何を: 購読操作の結果と状態照会のキャッシュ利用をメトリクスとして記録する
 * なぜ: トライアル発行や更新の失敗増加をダッシュボードで追えるようにするため
 */
package com.vpnbot.subscription.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SubscriptionMetrics {

  private static final String METRIC_OPERATIONS = "subscription.operations";
  private static final String METRIC_STATUS_LOOKUPS = "subscription.status.lookups";
  private static final String METRIC_EXPIRED_MARKED = "subscription.expired.marked";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> operationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> lookupCounters = new ConcurrentHashMap<>();
  private final Counter expiredMarked;

  public SubscriptionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.expiredMarked =
        Counter.builder(METRIC_EXPIRED_MARKED)
            .description("Subscriptions marked expired by the expiry check")
            .register(meterRegistry);
  }

  public void recordOperation(String operation, String result) {
    final String key = operation + "|" + result;
    operationCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_OPERATIONS)
                    .description("Subscription operation outcomes")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStatusLookup(String source) {
    lookupCounters
        .computeIfAbsent(
            source,
            ignored ->
                Counter.builder(METRIC_STATUS_LOOKUPS)
                    .description("Subscription status lookups by source")
                    .tags(Tags.of("source", source))
                    .register(meterRegistry))
        .increment();
  }

  public void recordExpiredMarked(int count) {
    expiredMarked.increment(count);
  }
}
