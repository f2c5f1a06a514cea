package com.vpnbot.subscription.http;

public enum CircuitState {
  CLOSED,
  OPEN,
  HALF_OPEN
}
