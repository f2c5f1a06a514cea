package com.vpnbot.subscription.http;

@FunctionalInterface
public interface CircuitTransitionListener {

  CircuitTransitionListener NONE = (name, from, to) -> {};

  void onTransition(String name, CircuitState from, CircuitState to);
}
