package com.vpnbot.subscription.panel;

import java.time.Instant;

public record PanelUserUsage(
    String username, long usedTraffic, long dataLimit, Instant expireAt, PanelUserStatus status) {

  public static PanelUserUsage of(PanelUser user) {
    return new PanelUserUsage(
        user.username(), user.usedTraffic(), user.dataLimit(), user.expireAt(), user.status());
  }
}
