package com.vpnbot.subscription.model;

/** 保存レコードから導出するライフサイクル上の位置。 */
public enum SubscriptionState {
  NON_EXISTENT,
  TRIAL,
  ACTIVE,
  EXPIRED,
  DISABLED
}
