package com.vpnbot.subscription.api.response;

public record SyncResponse(boolean synced) {}
