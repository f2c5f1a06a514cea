/*
 * どこで: Subscription HTTP 層
 * 何を: パネル呼び出しの連続失敗を数え、閾値到達で呼び出しを遮断する
 * なぜ: パネル停止中にリトライが積み重なって待ち時間と負荷を増やさないため
 */
package com.vpnbot.subscription.http;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CircuitBreaker {

  private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

  private final String name;
  private final int failureThreshold;
  private final Duration failureWindow;
  private final Duration openDuration;
  private final Clock clock;
  private final CircuitTransitionListener listener;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private Instant windowStartedAt;
  private Instant openedAt;
  private boolean trialInFlight;

  public CircuitBreaker(
      String name,
      int failureThreshold,
      Duration failureWindow,
      Duration openDuration,
      Clock clock,
      CircuitTransitionListener listener) {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    this.name = Objects.requireNonNull(name, "name");
    this.failureThreshold = failureThreshold;
    this.failureWindow = Objects.requireNonNull(failureWindow, "failureWindow");
    this.openDuration = Objects.requireNonNull(openDuration, "openDuration");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = listener == null ? CircuitTransitionListener.NONE : listener;
  }

  /**
   * 呼び出しを通してよいかを判定する。
   *
   * <p>OPEN で待機時間を過ぎていれば HALF_OPEN に移り、試行を 1 件だけ許可する。許可を得た呼び出しは必ず
   * {@link #onSuccess()}、{@link #onFailure()}、{@link #onIgnored()} のいずれかで結果を返すこと。
   */
  public synchronized boolean tryAcquirePermission() {
    switch (state) {
      case CLOSED:
        return true;
      case OPEN:
        if (clock.instant().isBefore(openedAt.plus(openDuration))) {
          return false;
        }
        transitionTo(CircuitState.HALF_OPEN);
        trialInFlight = true;
        return true;
      case HALF_OPEN:
        if (trialInFlight) {
          return false;
        }
        trialInFlight = true;
        return true;
      default:
        throw new IllegalStateException("unknown circuit state: " + state);
    }
  }

  public synchronized void onSuccess() {
    failureCount = 0;
    windowStartedAt = null;
    if (state == CircuitState.HALF_OPEN) {
      trialInFlight = false;
      transitionTo(CircuitState.CLOSED);
    }
  }

  public synchronized void onFailure() {
    final Instant now = clock.instant();
    if (state == CircuitState.HALF_OPEN) {
      trialInFlight = false;
      open(now);
      return;
    }
    if (state == CircuitState.OPEN) {
      return;
    }
    if (windowStartedAt == null || !now.isBefore(windowStartedAt.plus(failureWindow))) {
      windowStartedAt = now;
      failureCount = 0;
    }
    failureCount++;
    if (failureCount >= failureThreshold) {
      open(now);
    }
  }

  /** 状態に影響しない結果 (認証拒否や 4xx)。HALF_OPEN の試行枠だけ返却する。 */
  public synchronized void onIgnored() {
    if (state == CircuitState.HALF_OPEN) {
      trialInFlight = false;
    }
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }

  public String name() {
    return name;
  }

  private void open(Instant now) {
    openedAt = now;
    failureCount = 0;
    windowStartedAt = null;
    transitionTo(CircuitState.OPEN);
  }

  private void transitionTo(CircuitState next) {
    final CircuitState previous = state;
    if (previous == next) {
      return;
    }
    state = next;
    logger.warn("circuit transition name={} from={} to={}", name, previous, next);
    listener.onTransition(name, previous, next);
  }
}
