package com.vpnbot.subscription.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 外部ユーザー ID に紐づく購読レコード。
 *
 * @param dataLimit バイト数。0 は無制限
 * @param expireAt null は無期限
 * @param trial 現在の期間がトライアルなら true
 * @param trialUsed 一度でもトライアルを付与したら true
 */
public record SubscriptionRecord(
    long userId,
    String panelUsername,
    long dataLimit,
    long usedTraffic,
    Instant expireAt,
    SubscriptionStatus status,
    String subscriptionUrl,
    boolean trial,
    boolean trialUsed,
    Instant updatedAt) {

  public SubscriptionRecord {
    Objects.requireNonNull(panelUsername, "panelUsername");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /** status が expired、期限切れ、通信量超過のいずれかなら期限切れ。 */
  public boolean isExpiredAt(Instant now) {
    if (status == SubscriptionStatus.EXPIRED) {
      return true;
    }
    if (expireAt != null && !now.isBefore(expireAt)) {
      return true;
    }
    return dataLimit > 0 && usedTraffic >= dataLimit;
  }

  public SubscriptionState lifecycleState(Instant now) {
    if (status == SubscriptionStatus.DISABLED) {
      return SubscriptionState.DISABLED;
    }
    if (isExpiredAt(now)) {
      return SubscriptionState.EXPIRED;
    }
    return trial ? SubscriptionState.TRIAL : SubscriptionState.ACTIVE;
  }

  public SubscriptionRecord withStatus(SubscriptionStatus nextStatus, Instant now) {
    return new SubscriptionRecord(
        userId,
        panelUsername,
        dataLimit,
        usedTraffic,
        expireAt,
        nextStatus,
        subscriptionUrl,
        trial,
        trialUsed,
        now);
  }
}
