package com.vpnbot.subscription.cache;

/** キャッシュ TTL の段階。実際の長さは設定から解決する。 */
public enum CacheTtl {
  SHORT,
  MEDIUM,
  LONG
}
