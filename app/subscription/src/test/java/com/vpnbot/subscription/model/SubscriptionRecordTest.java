package com.vpnbot.subscription.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SubscriptionRecordTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Test
  void expiresAtExactExpiryInstant() {
    final SubscriptionRecord record =
        record(100L, 0L, NOW.plusSeconds(60), SubscriptionStatus.ACTIVE);

    assertThat(record.isExpiredAt(NOW)).isFalse();
    assertThat(record.isExpiredAt(NOW.plusSeconds(60))).isTrue();
  }

  @Test
  void reachingDataLimitCountsAsExpired() {
    assertThat(record(100L, 99L, null, SubscriptionStatus.ACTIVE).isExpiredAt(NOW)).isFalse();
    assertThat(record(100L, 100L, null, SubscriptionStatus.ACTIVE).isExpiredAt(NOW)).isTrue();
    assertThat(record(0L, 1_000_000L, null, SubscriptionStatus.ACTIVE).isExpiredAt(NOW)).isFalse();
  }

  @Test
  void lifecycleStateReflectsTrialDisabledAndExpiry() {
    final Instant later = NOW.plus(Duration.ofDays(3));

    assertThat(record(100L, 0L, later, SubscriptionStatus.ACTIVE).lifecycleState(NOW))
        .isEqualTo(SubscriptionState.TRIAL);
    assertThat(record(100L, 0L, later, SubscriptionStatus.DISABLED).lifecycleState(NOW))
        .isEqualTo(SubscriptionState.DISABLED);
    assertThat(record(100L, 0L, later, SubscriptionStatus.EXPIRED).lifecycleState(NOW))
        .isEqualTo(SubscriptionState.EXPIRED);
    assertThat(
            record(100L, 0L, later, SubscriptionStatus.ACTIVE)
                .withStatus(SubscriptionStatus.EXPIRED, NOW)
                .status())
        .isEqualTo(SubscriptionStatus.EXPIRED);
  }

  private static SubscriptionRecord record(
      long dataLimit, long used, Instant expireAt, SubscriptionStatus status) {
    return new SubscriptionRecord(
        1L, "user_1_1", dataLimit, used, expireAt, status, null, true, true, NOW);
  }
}
