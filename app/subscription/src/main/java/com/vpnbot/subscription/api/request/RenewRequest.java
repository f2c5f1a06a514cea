package com.vpnbot.subscription.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/** {@code days} か {@code plan} のどちらか一方を指定する。 */
public record RenewRequest(@Min(1) @Max(365) Integer days, @Size(max = 8) String plan) {}
