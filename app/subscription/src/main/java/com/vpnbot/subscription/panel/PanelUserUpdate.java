package com.vpnbot.subscription.panel;

import java.time.Instant;

/** 部分更新。null の項目は送信しない。 */
public record PanelUserUpdate(Long dataLimit, Instant expireAt, PanelUserStatus status) {

  public static PanelUserUpdate status(PanelUserStatus status) {
    return new PanelUserUpdate(null, null, status);
  }

  public boolean isEmpty() {
    return dataLimit == null && expireAt == null && status == null;
  }
}
