package com.vpnbot.subscription.api.response;

public record PanelHealthResponse(String status) {}
