package com.vpnbot.subscription.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vpnbot.subscription.model.SubscriptionRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExpiringSubscriptionResponse(
    String userId, String panelUsername, String expireAt, boolean trial) {

  public static ExpiringSubscriptionResponse from(SubscriptionRecord record) {
    return new ExpiringSubscriptionResponse(
        Long.toString(record.userId()),
        record.panelUsername(),
        record.expireAt().toString(),
        record.trial());
  }
}
