/*
 * どこで: Subscription 設定
 * 何を: パネル呼び出しのリトライ/バックオフ/サーキットブレーカー設定を保持する
 * なぜ: 障害時の挙動を再ビルドなしで調整するため
 */
package com.vpnbot.subscription.config;

import com.vpnbot.subscription.http.RetryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "panel.resilience")
public record PanelResilienceProperties(
    Integer maxAttempts,
    Duration backoffBase,
    Double backoffMultiplier,
    Duration backoffJitter,
    Duration backoffMax,
    List<Integer> retryableStatuses,
    Integer failureThreshold,
    Duration failureWindow,
    Duration openDuration) {

  public PanelResilienceProperties {
    maxAttempts = maxAttempts == null ? 3 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofSeconds(1) : backoffBase;
    backoffMultiplier = backoffMultiplier == null ? 1.5d : backoffMultiplier;
    backoffJitter = backoffJitter == null ? Duration.ofMillis(250) : backoffJitter;
    backoffMax = backoffMax == null ? Duration.ofSeconds(10) : backoffMax;
    retryableStatuses =
        retryableStatuses == null ? List.of(429, 502, 503, 504) : List.copyOf(retryableStatuses);
    failureThreshold = failureThreshold == null ? 5 : failureThreshold;
    failureWindow = failureWindow == null ? Duration.ofSeconds(60) : failureWindow;
    openDuration = openDuration == null ? Duration.ofSeconds(60) : openDuration;
  }

  public RetryPolicy toRetryPolicy() {
    return new RetryPolicy(
        maxAttempts,
        backoffBase,
        backoffMultiplier,
        backoffJitter,
        backoffMax,
        RetryPolicy.DEFAULT_RETRYABLE_KINDS,
        Set.copyOf(retryableStatuses));
  }
}
