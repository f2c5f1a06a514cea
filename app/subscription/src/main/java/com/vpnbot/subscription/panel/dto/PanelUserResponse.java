package com.vpnbot.subscription.panel.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PanelUserResponse(
    String username,
    Long dataLimit,
    Long usedTraffic,
    Long expire,
    String status,
    String subscriptionUrl) {}
