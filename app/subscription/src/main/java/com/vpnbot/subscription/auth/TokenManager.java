/*
 * どこで: Subscription 認証層
 * 何を: パネル管理者トークンを取得・保持し、期限切れや 401 で再取得する
 * なぜ: 資格情報の失効を呼び出し側から隠し、同時再取得でトークン発行を重複させないため
 */
package com.vpnbot.subscription.auth;

import com.google.common.base.Throwables;
import com.vpnbot.subscription.auth.dto.PanelTokenResponse;
import com.vpnbot.subscription.config.PanelClientProperties;
import com.vpnbot.subscription.http.PanelMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
@RequiredArgsConstructor
public class TokenManager implements CredentialProvider {

  private static final Logger logger = LoggerFactory.getLogger(TokenManager.class);

  private final RestClient panelRestClient;
  private final PanelClientProperties properties;
  private final Clock clock;
  private final PanelMetrics metrics;

  private final AtomicReference<Credential> current = new AtomicReference<>();
  private final AtomicReference<CompletableFuture<Credential>> inFlight = new AtomicReference<>();

  @Override
  public Credential getCredential() {
    final Credential snapshot = current.get();
    if (snapshot != null && isUsable(snapshot)) {
      return snapshot;
    }
    return refresh(snapshot, false);
  }

  @Override
  public Credential refreshAfterRejection(Credential rejected) {
    return refresh(rejected, false);
  }

  /** 保持中のトークンに関係なく再認証する。実行中の再取得があればその結果を共有する。 */
  public Credential forceRefresh() {
    return refresh(current.get(), true);
  }

  public boolean isAuthenticated() {
    try {
      getCredential();
      return true;
    } catch (AuthenticationException ex) {
      logger.warn("panel authentication check failed transient={}", ex.isTransientFailure());
      return false;
    }
  }

  private Credential refresh(Credential observed, boolean force) {
    while (true) {
      final CompletableFuture<Credential> running = inFlight.get();
      if (running != null) {
        return await(running);
      }
      final CompletableFuture<Credential> mine = new CompletableFuture<>();
      if (!inFlight.compareAndSet(null, mine)) {
        continue;
      }
      try {
        final Credential latest = current.get();
        // 待っている間に別スレッドが置き換えていれば再認証しない
        if (!force && latest != null && latest != observed && isUsable(latest)) {
          mine.complete(latest);
          return latest;
        }
        final Credential fresh = authenticate();
        current.set(fresh);
        mine.complete(fresh);
        return fresh;
      } catch (RuntimeException ex) {
        mine.completeExceptionally(ex);
        throw ex;
      } finally {
        inFlight.compareAndSet(mine, null);
      }
    }
  }

  private Credential await(CompletableFuture<Credential> running) {
    try {
      return running.join();
    } catch (CompletionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new AuthenticationException(true, "panel token refresh failed", cause);
    }
  }

  private Credential authenticate() {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("username", properties.username());
    form.add("password", properties.password());
    final PanelTokenResponse response;
    try {
      response =
          panelRestClient
              .post()
              .uri(properties.tokenPath())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(PanelTokenResponse.class);
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      logger.warn("panel token request failed with http status={}", status);
      metrics.recordCredentialRefresh("failure");
      if (ex.getStatusCode().is4xxClientError()) {
        throw new AuthenticationException(false, "panel rejected admin credentials", ex);
      }
      throw new AuthenticationException(true, "panel token endpoint error", ex);
    } catch (ResourceAccessException ex) {
      logger.warn("panel token request connection failed", ex);
      metrics.recordCredentialRefresh("failure");
      throw new AuthenticationException(true, "panel token endpoint unreachable", ex);
    } catch (RestClientException ex) {
      logger.warn("panel token response parse failed", ex);
      metrics.recordCredentialRefresh("failure");
      throw new AuthenticationException(false, "panel token response parse failed", ex);
    }
    if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
      logger.warn("panel token response has no access_token");
      metrics.recordCredentialRefresh("failure");
      throw new AuthenticationException(false, "panel token response is invalid");
    }
    final Instant now = clock.instant();
    final Instant expiresAt =
        response.expiresIn() == null || response.expiresIn() <= 0
            ? null
            : now.plus(Duration.ofSeconds(response.expiresIn()));
    metrics.recordCredentialRefresh("success");
    logger.info("panel token refreshed expiresAt={}", expiresAt);
    return new Credential(response.accessToken(), now, expiresAt);
  }

  private boolean isUsable(Credential credential) {
    return credential.isUsableAt(
        clock.instant(), properties.tokenFallbackTtl(), properties.tokenRefreshSkew());
  }
}
