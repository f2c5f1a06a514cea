package com.vpnbot.subscription.service;

public class SubscriptionNotFoundException extends RuntimeException {

  public SubscriptionNotFoundException(long userId) {
    super("subscription not found for user " + userId);
  }
}
