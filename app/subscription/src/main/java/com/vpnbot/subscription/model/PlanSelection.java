package com.vpnbot.subscription.model;

public record PlanSelection(String code, int days, long dataLimit, long price) {}
