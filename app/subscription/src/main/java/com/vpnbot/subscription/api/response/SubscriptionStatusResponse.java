package com.vpnbot.subscription.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vpnbot.subscription.model.SubscriptionStatusView;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionStatusResponse(
    String userId,
    String panelUsername,
    String status,
    long dataLimit,
    long usedTraffic,
    String expireAt,
    String subscriptionUrl) {

  public static SubscriptionStatusResponse from(SubscriptionStatusView view) {
    return new SubscriptionStatusResponse(
        Long.toString(view.userId()),
        view.panelUsername(),
        view.status().wireValue(),
        view.dataLimit(),
        view.usedTraffic(),
        view.expireAt() == null ? null : view.expireAt().toString(),
        view.subscriptionUrl());
  }
}
