package com.vpnbot.subscription.model;

/** ボットのボタン押下データ {@code action:argument} を分解した値。argument は省略可。 */
public record CallbackPayload(String action, String argument) {}
