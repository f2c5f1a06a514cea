/*
 * どこで: Subscription HTTP 層
 * 何を: パネル呼び出しに認証ヘッダ付与・リトライ・指数バックオフ・サーキットブレーカー・全体タイムアウトを適用する
 * なぜ: 一時的な通信障害やトークン失効を上位のドメイン処理へ漏らさないため
 */
package com.vpnbot.subscription.http;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.vpnbot.subscription.auth.AuthenticationException;
import com.vpnbot.subscription.auth.Credential;
import com.vpnbot.subscription.auth.CredentialProvider;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class ResilientHttpClient implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ResilientHttpClient.class);

  private final RestClient restClient;
  private final CredentialProvider credentialProvider;
  private final CircuitBreaker circuitBreaker;
  private final RetryPolicy defaultPolicy;
  private final Duration defaultTimeout;
  private final ExecutorService attemptExecutor;
  private final Sleeper sleeper;
  private final Ticker ticker;
  private final PanelMetrics metrics;

  public ResilientHttpClient(
      RestClient restClient,
      CredentialProvider credentialProvider,
      CircuitBreaker circuitBreaker,
      RetryPolicy defaultPolicy,
      Duration defaultTimeout,
      ExecutorService attemptExecutor,
      Sleeper sleeper,
      Ticker ticker,
      PanelMetrics metrics) {
    this.restClient = restClient;
    this.credentialProvider = credentialProvider;
    this.circuitBreaker = circuitBreaker;
    this.defaultPolicy = defaultPolicy;
    this.defaultTimeout = defaultTimeout;
    this.attemptExecutor = attemptExecutor;
    this.sleeper = sleeper;
    this.ticker = ticker;
    this.metrics = metrics;
  }

  /** 試行用スレッドプールを停止する。実行中の試行は中断される。 */
  @Override
  public void close() {
    attemptExecutor.shutdownNow();
  }

  public <T> T execute(UpstreamRequest<T> request) {
    return execute(request, defaultPolicy, defaultTimeout);
  }

  public <T> T execute(UpstreamRequest<T> request, RetryPolicy policy, Duration timeout) {
    final String operation = request.operation();
    final Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    final long deadlineNanos = ticker.read() + timeout.toNanos();

    if (!circuitBreaker.tryAcquirePermission()) {
      logger.warn("panel call rejected by open circuit operation={}", operation);
      metrics.recordCall(operation, "circuit_open", stopwatch.elapsed());
      throw new UpstreamCallException(
          UpstreamFailureKind.CIRCUIT_OPEN, "panel circuit is open operation=" + operation);
    }

    int attempt = 1;
    boolean credentialRefreshed = false;
    Credential rejected = null;
    final AtomicReference<Credential> usedCredential = new AtomicReference<>();
    while (true) {
      try {
        final T result = runAttempt(request, rejected, usedCredential, deadlineNanos);
        circuitBreaker.onSuccess();
        metrics.recordCall(operation, "success", stopwatch.elapsed());
        return result;
      } catch (UpstreamCallException ex) {
        rejected = null;
        if (ex.kind() == UpstreamFailureKind.UNAUTHORIZED && !credentialRefreshed) {
          // 401 は 1 回だけ資格情報を更新して即再送する。試行回数は消費しない
          logger.info("panel rejected credential, refreshing operation={}", operation);
          credentialRefreshed = true;
          rejected = usedCredential.get();
          continue;
        }
        if (!policy.isRetryable(ex)) {
          circuitBreaker.onIgnored();
          logger.warn(
              "panel call failed without retry operation={} kind={} status={}",
              operation,
              ex.kind(),
              ex.statusCode());
          metrics.recordCall(operation, "rejected", stopwatch.elapsed());
          throw ex;
        }
        if (attempt >= policy.maxAttempts()) {
          circuitBreaker.onFailure();
          logger.warn(
              "panel call exhausted retries operation={} attempts={} kind={}",
              operation,
              attempt,
              ex.kind());
          metrics.recordCall(operation, "failure", stopwatch.elapsed());
          throw ex;
        }
        final Duration backoff = policy.backoffFor(attempt);
        if (backoff.toNanos() >= remainingNanos(deadlineNanos)) {
          circuitBreaker.onFailure();
          logger.warn(
              "panel call deadline exceeded operation={} attempts={} kind={}",
              operation,
              attempt,
              ex.kind());
          metrics.recordCall(operation, "timeout", stopwatch.elapsed());
          throw new UpstreamCallException(
              UpstreamFailureKind.TIMEOUT,
              ex.statusCode(),
              "panel call deadline exceeded operation=" + operation,
              ex);
        }
        logger.warn(
            "panel call failed, retrying operation={} attempt={} kind={} backoffMs={}",
            operation,
            attempt,
            ex.kind(),
            backoff.toMillis());
        metrics.recordRetry(operation, ex.kind());
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          circuitBreaker.onIgnored();
          metrics.recordCall(operation, "interrupted", stopwatch.elapsed());
          throw new UpstreamCallException(
              UpstreamFailureKind.TIMEOUT, "panel call interrupted operation=" + operation, ex);
        }
        attempt++;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        circuitBreaker.onIgnored();
        metrics.recordCall(operation, "interrupted", stopwatch.elapsed());
        throw new UpstreamCallException(
            UpstreamFailureKind.TIMEOUT, "panel call interrupted operation=" + operation, ex);
      } catch (RuntimeException ex) {
        circuitBreaker.onIgnored();
        metrics.recordCall(operation, "error", stopwatch.elapsed());
        throw ex;
      }
    }
  }

  private <T> T runAttempt(
      UpstreamRequest<T> request,
      Credential rejected,
      AtomicReference<Credential> usedCredential,
      long deadlineNanos)
      throws InterruptedException {
    final long remaining = remainingNanos(deadlineNanos);
    if (remaining <= 0) {
      throw new UpstreamCallException(
          UpstreamFailureKind.TIMEOUT,
          "panel call deadline exceeded operation=" + request.operation());
    }
    final Future<T> future =
        attemptExecutor.submit(
            () -> dispatch(request, rejected, usedCredential));
    try {
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new UpstreamCallException(
          UpstreamFailureKind.TIMEOUT, "panel call timed out operation=" + request.operation(), ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new UpstreamCallException(
          UpstreamFailureKind.INVALID_RESPONSE,
          "panel call failed operation=" + request.operation(),
          cause);
    }
  }

  private <T> T dispatch(
      UpstreamRequest<T> request,
      Credential rejected,
      AtomicReference<Credential> usedCredential) {
    try {
      final Credential credential =
          rejected == null
              ? credentialProvider.getCredential()
              : credentialProvider.refreshAfterRejection(rejected);
      usedCredential.set(credential);
      final RestClient.RequestBodySpec spec =
          restClient
              .method(request.method())
              .uri(request.uriTemplate(), request.uriVariables())
              .header(HttpHeaders.AUTHORIZATION, credential.authorizationHeaderValue());
      if (request.body() != null) {
        spec.contentType(MediaType.APPLICATION_JSON).body(request.body());
      }
      final RestClient.ResponseSpec response = spec.retrieve();
      if (!request.expectsBody()) {
        response.toBodilessEntity();
        return null;
      }
      final T body = response.body(request.responseType());
      if (body == null) {
        throw new UpstreamCallException(
            UpstreamFailureKind.INVALID_RESPONSE,
            "panel response is empty operation=" + request.operation());
      }
      return body;
    } catch (RestClientResponseException ex) {
      throw classifyStatus(request.operation(), ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new UpstreamCallException(
            UpstreamFailureKind.TIMEOUT,
            "panel request timeout operation=" + request.operation(),
            ex);
      }
      throw new UpstreamCallException(
          UpstreamFailureKind.TRANSIENT_NETWORK,
          "panel connection failed operation=" + request.operation(),
          ex);
    } catch (RestClientException ex) {
      throw new UpstreamCallException(
          UpstreamFailureKind.INVALID_RESPONSE,
          "panel response parse failed operation=" + request.operation(),
          ex);
    } catch (AuthenticationException ex) {
      if (ex.isTransientFailure()) {
        throw new UpstreamCallException(
            UpstreamFailureKind.TRANSIENT_NETWORK,
            "panel authentication unavailable operation=" + request.operation(),
            ex);
      }
      throw new UpstreamCallException(
          UpstreamFailureKind.AUTHENTICATION,
          "panel authentication rejected operation=" + request.operation(),
          ex);
    }
  }

  private UpstreamCallException classifyStatus(String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401) {
      return new UpstreamCallException(
          UpstreamFailureKind.UNAUTHORIZED, status, "panel rejected credential", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new UpstreamCallException(
          UpstreamFailureKind.SERVER_ERROR,
          status,
          "panel server error operation=" + operation,
          ex);
    }
    return new UpstreamCallException(
        UpstreamFailureKind.CLIENT_ERROR,
        status,
        "panel rejected request operation=" + operation,
        ex);
  }

  private long remainingNanos(long deadlineNanos) {
    return deadlineNanos - ticker.read();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
