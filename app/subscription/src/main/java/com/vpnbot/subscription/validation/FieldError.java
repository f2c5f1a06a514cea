package com.vpnbot.subscription.validation;

public record FieldError(String field, String message) {}
