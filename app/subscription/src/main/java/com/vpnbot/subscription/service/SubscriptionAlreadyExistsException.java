package com.vpnbot.subscription.service;

public class SubscriptionAlreadyExistsException extends RuntimeException {

  public SubscriptionAlreadyExistsException(long userId) {
    super("subscription already exists for user " + userId);
  }
}
