/*
 * どこで: Subscription キャッシュ層
 * 何を: キーごとに TTL 付きで値を保持し、ミス時の読み込みを同一キーで 1 回にまとめる
 * なぜ: 同じユーザーの状態照会でパネルへの重複呼び出しを避けるため
 */
package com.vpnbot.subscription.cache;

import com.google.common.base.Throwables;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TtlCache<K, V> {

  private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

  private final String name;
  private final Clock clock;
  private final ConcurrentMap<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
  private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
  // 読み込み結果の保存と invalidate/set の競合を直列化する
  private final Object storeLock = new Object();

  public TtlCache(String name, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Optional<V> get(K key) {
    final CacheEntry<V> entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpiredAt(clock.instant())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  public void set(K key, V value, Duration ttl) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    requirePositive(ttl);
    synchronized (storeLock) {
      // 実行中の読み込み結果で上書きさせない
      inFlight.remove(key);
      entries.put(key, new CacheEntry<>(value, clock.instant(), ttl));
    }
  }

  public void invalidate(K key) {
    synchronized (storeLock) {
      inFlight.remove(key);
      entries.remove(key);
    }
  }

  /**
   * キャッシュを優先して値を返し、ミス時は {@code loader} で読み込んで保存する。
   *
   * <p>同一キーへの同時ミスは 1 回の読み込みを共有する。読み込み中に {@link #invalidate} された場合、
   * 結果は呼び出し元へ返すが保存しない。
   * 読み込みの失敗は保存せず、待機中の全呼び出し元へ同じ例外を投げる。
   */
  public V getOrLoad(K key, Duration ttl, Supplier<? extends V> loader) {
    requirePositive(ttl);
    final Optional<V> cached = get(key);
    if (cached.isPresent()) {
      return cached.get();
    }
    final CompletableFuture<V> mine = new CompletableFuture<>();
    final CompletableFuture<V> running = inFlight.putIfAbsent(key, mine);
    if (running != null) {
      return await(running);
    }
    try {
      final Optional<V> stored = get(key);
      if (stored.isPresent()) {
        inFlight.remove(key, mine);
        mine.complete(stored.get());
        return stored.get();
      }
      final V value = Objects.requireNonNull(loader.get(), "loader returned null");
      synchronized (storeLock) {
        if (inFlight.remove(key, mine)) {
          entries.put(key, new CacheEntry<>(value, clock.instant(), ttl));
        } else {
          logger.debug("cache load discarded after invalidation cache={} key={}", name, key);
        }
      }
      mine.complete(value);
      return value;
    } catch (RuntimeException | Error ex) {
      inFlight.remove(key, mine);
      mine.completeExceptionally(ex);
      throw ex;
    }
  }

  /** 期限切れエントリをすべて削除し、削除件数を返す。 */
  public int sweepExpired() {
    final Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<K, CacheEntry<V>> entry : entries.entrySet()) {
      if (entry.getValue().isExpiredAt(now) && entries.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      logger.debug("cache sweep cache={} removed={}", name, removed);
    }
    return removed;
  }

  public void clear() {
    synchronized (storeLock) {
      inFlight.clear();
      entries.clear();
    }
  }

  public int size() {
    return entries.size();
  }

  public String name() {
    return name;
  }

  private V await(CompletableFuture<V> running) {
    try {
      return running.join();
    } catch (CompletionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException("cache load failed cache=" + name, cause);
    }
  }

  private static void requirePositive(Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
  }
}
