package com.vpnbot.subscription.model;

import java.time.Instant;

public record SubscriptionStatusView(
    long userId,
    String panelUsername,
    SubscriptionStatus status,
    long dataLimit,
    long usedTraffic,
    Instant expireAt,
    String subscriptionUrl) {}
