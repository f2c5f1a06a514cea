package com.vpnbot.subscription.panel;

import java.time.Instant;

/**
 * パネル上のユーザー資源。
 *
 * @param dataLimit 0 は無制限
 * @param expireAt null は無期限
 */
public record PanelUser(
    String username,
    long dataLimit,
    long usedTraffic,
    Instant expireAt,
    PanelUserStatus status,
    String subscriptionUrl) {}
