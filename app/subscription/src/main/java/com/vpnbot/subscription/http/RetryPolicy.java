/*
 * どこで: Subscription HTTP 層
 * 何を: 最大試行回数・指数バックオフ・ジッター・リトライ対象を保持する
 * なぜ: 呼び出しごとに同じ不変ポリシーを共有し、失敗時の待機時間を一箇所で決めるため
 */
package com.vpnbot.subscription.http;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(
    int maxAttempts,
    Duration backoffBase,
    double backoffMultiplier,
    Duration backoffJitter,
    Duration backoffMax,
    Set<UpstreamFailureKind> retryableKinds,
    Set<Integer> retryableStatuses) {

  public static final Set<UpstreamFailureKind> DEFAULT_RETRYABLE_KINDS =
      Set.copyOf(
          EnumSet.of(
              UpstreamFailureKind.TRANSIENT_NETWORK,
              UpstreamFailureKind.TIMEOUT,
              UpstreamFailureKind.SERVER_ERROR));

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (backoffMultiplier < 1.0d) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }
    Objects.requireNonNull(backoffBase, "backoffBase");
    Objects.requireNonNull(backoffJitter, "backoffJitter");
    Objects.requireNonNull(backoffMax, "backoffMax");
    retryableKinds = retryableKinds == null ? DEFAULT_RETRYABLE_KINDS : Set.copyOf(retryableKinds);
    retryableStatuses = retryableStatuses == null ? Set.of() : Set.copyOf(retryableStatuses);
  }

  public boolean isRetryable(UpstreamCallException ex) {
    if (retryableKinds.contains(ex.kind())) {
      return true;
    }
    return ex.kind() == UpstreamFailureKind.CLIENT_ERROR
        && retryableStatuses.contains(ex.statusCode());
  }

  /** attempt 回目の失敗後に待つ時間。attempt は 1 始まり。 */
  public Duration backoffFor(int attempt) {
    return backoffFor(attempt, ThreadLocalRandom.current().nextDouble());
  }

  @VisibleForTesting
  Duration backoffFor(int attempt, double randomUnit) {
    final double baseMillis = backoffBase.toMillis();
    final double exp = baseMillis * Math.pow(backoffMultiplier, attempt - 1);
    final double capped = Math.min(exp, backoffMax.toMillis());
    // [-jitter, +jitter] の一様ジッター
    final double jitter = (randomUnit * 2.0d - 1.0d) * backoffJitter.toMillis();
    final long millis = (long) Math.ceil(capped + jitter);
    return Duration.ofMillis(Math.max(0L, millis));
  }
}
