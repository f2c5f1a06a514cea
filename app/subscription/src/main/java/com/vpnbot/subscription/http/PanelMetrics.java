/*
 * どこで: Subscription HTTP 層
 * 何を: パネル呼び出し結果・リトライ・ブレーカー遷移・トークン更新のメトリクスを記録する
 * なぜ: パネル障害の発生と回復を Prometheus から直接観測できるようにするため
 */
package com.vpnbot.subscription.http;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class PanelMetrics {

  private static final String METRIC_CALLS = "panel.http.calls";
  private static final String METRIC_CALL_DURATION = "panel.http.call.duration";
  private static final String METRIC_RETRIES = "panel.http.retries";
  private static final String METRIC_CIRCUIT_TRANSITIONS = "panel.circuit.transitions";
  private static final String METRIC_CIRCUIT_STATE = "panel.circuit.state";
  private static final String METRIC_CREDENTIAL_REFRESH = "panel.auth.refresh";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> callCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> callTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> refreshCounters = new ConcurrentHashMap<>();

  public PanelMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCall(String operation, String result, Duration duration) {
    final String key = operation + "|" + result;
    callCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CALLS)
                    .description("Panel API call outcomes")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry))
        .increment();
    callTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_CALL_DURATION)
                    .description("Panel API logical call duration including retries")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordRetry(String operation, UpstreamFailureKind kind) {
    final String reason = kind.name().toLowerCase(Locale.ROOT);
    final String key = operation + "|" + reason;
    retryCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_RETRIES)
                    .description("Panel API retries by failure kind")
                    .tags(Tags.of("operation", operation, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCircuitTransition(String name, CircuitState from, CircuitState to) {
    final String key = name + "|" + from + "|" + to;
    transitionCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CIRCUIT_TRANSITIONS)
                    .description("Circuit breaker state transitions")
                    .tags(Tags.of("name", name, "from", from.name(), "to", to.name()))
                    .register(meterRegistry))
        .increment();
  }

  /** CLOSED=0, OPEN=1, HALF_OPEN=2 として状態を公開する。 */
  public void registerCircuitState(CircuitBreaker circuitBreaker) {
    Gauge.builder(METRIC_CIRCUIT_STATE, circuitBreaker, cb -> cb.state().ordinal())
        .description("Current circuit breaker state")
        .tags(Tags.of("name", circuitBreaker.name()))
        .register(meterRegistry);
  }

  public void recordCredentialRefresh(String result) {
    refreshCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CREDENTIAL_REFRESH)
                    .description("Panel admin token refresh outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
