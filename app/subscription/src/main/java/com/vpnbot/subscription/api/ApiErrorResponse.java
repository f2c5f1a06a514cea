package com.vpnbot.subscription.api;

public record ApiErrorResponse(String code, String message) {}
