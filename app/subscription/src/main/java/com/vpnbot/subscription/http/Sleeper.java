package com.vpnbot.subscription.http;

import java.time.Duration;

/** バックオフ待機。テストで実時間を待たずに検証するために差し替える。 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
