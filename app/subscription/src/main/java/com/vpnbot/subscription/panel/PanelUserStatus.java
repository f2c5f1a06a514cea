package com.vpnbot.subscription.panel;

import java.util.Arrays;
import java.util.Optional;

public enum PanelUserStatus {
  ACTIVE("active"),
  DISABLED("disabled"),
  LIMITED("limited"),
  EXPIRED("expired"),
  ON_HOLD("on_hold");

  private final String wireValue;

  PanelUserStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public static Optional<PanelUserStatus> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.wireValue.equals(value)).findFirst();
  }
}
