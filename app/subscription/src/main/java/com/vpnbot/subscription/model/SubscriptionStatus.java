package com.vpnbot.subscription.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SubscriptionStatus {
  ACTIVE,
  EXPIRED,
  DISABLED;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
