/*
 * どこで: Subscription パネル連携層
 * 何を: パネルのユーザー資源 (作成/取得/更新/削除) を型付きで呼び出す
 * なぜ: 通信失敗の分類をドメインエラーへ変換し、サービス層を HTTP から切り離すため
 */
package com.vpnbot.subscription.panel;

import com.vpnbot.subscription.auth.TokenManager;
import com.vpnbot.subscription.config.PanelClientProperties;
import com.vpnbot.subscription.http.ResilientHttpClient;
import com.vpnbot.subscription.http.UpstreamCallException;
import com.vpnbot.subscription.http.UpstreamRequest;
import com.vpnbot.subscription.panel.dto.PanelUserCreateRequest;
import com.vpnbot.subscription.panel.dto.PanelUserResponse;
import com.vpnbot.subscription.panel.dto.PanelUserUpdateRequest;
import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PanelApiClient {

  private static final Logger logger = LoggerFactory.getLogger(PanelApiClient.class);

  static final String OP_CREATE_USER = "create_user";
  static final String OP_GET_USER = "get_user";
  static final String OP_UPDATE_USER = "update_user";
  static final String OP_DELETE_USER = "delete_user";

  private final ResilientHttpClient panelHttpClient;
  private final TokenManager tokenManager;
  private final PanelClientProperties properties;

  public PanelUser createUser(@NonNull String username, long dataLimit, Instant expireAt) {
    requireUsername(username);
    final PanelUserCreateRequest body =
        PanelUserCreateRequest.vless(
            username, dataLimit, toEpochSeconds(expireAt), PanelUserStatus.ACTIVE.wireValue());
    final PanelUserResponse response =
        call(
            OP_CREATE_USER,
            () ->
                panelHttpClient.execute(
                    UpstreamRequest.post(
                        OP_CREATE_USER, properties.usersPath(), body, PanelUserResponse.class)));
    return toPanelUser(OP_CREATE_USER, response);
  }

  public PanelUser getUser(@NonNull String username) {
    requireUsername(username);
    final PanelUserResponse response =
        call(
            OP_GET_USER,
            () ->
                panelHttpClient.execute(
                    UpstreamRequest.get(
                        OP_GET_USER,
                        properties.userPath(),
                        Map.of("username", username),
                        PanelUserResponse.class)));
    return toPanelUser(OP_GET_USER, response);
  }

  public PanelUser updateUser(@NonNull String username, @NonNull PanelUserUpdate update) {
    requireUsername(username);
    if (update.isEmpty()) {
      throw new IllegalArgumentException("update has no fields");
    }
    final PanelUserUpdateRequest body =
        new PanelUserUpdateRequest(
            update.dataLimit(),
            toEpochSeconds(update.expireAt()),
            update.status() == null ? null : update.status().wireValue());
    final PanelUserResponse response =
        call(
            OP_UPDATE_USER,
            () ->
                panelHttpClient.execute(
                    UpstreamRequest.put(
                        OP_UPDATE_USER,
                        properties.userPath(),
                        Map.of("username", username),
                        body,
                        PanelUserResponse.class)));
    return toPanelUser(OP_UPDATE_USER, response);
  }

  public void deleteUser(@NonNull String username) {
    requireUsername(username);
    call(
        OP_DELETE_USER,
        () ->
            panelHttpClient.execute(
                UpstreamRequest.delete(
                    OP_DELETE_USER, properties.userPath(), Map.of("username", username))));
  }

  public PanelUserUsage getUserUsage(@NonNull String username) {
    return PanelUserUsage.of(getUser(username));
  }

  /** 管理者トークンを取得できればパネルは利用可能とみなす。 */
  public boolean healthCheck() {
    return tokenManager.isAuthenticated();
  }

  private <T> T call(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (UpstreamCallException ex) {
      throw translate(operation, ex);
    }
  }

  private PanelIntegrationException translate(String operation, UpstreamCallException ex) {
    switch (ex.kind()) {
      case CLIENT_ERROR:
        if (ex.hasStatus(404)) {
          return new PanelIntegrationException(
              PanelIntegrationException.Reason.NOT_FOUND, "panel user not found", ex);
        }
        if (ex.hasStatus(409)) {
          return new PanelIntegrationException(
              PanelIntegrationException.Reason.CONFLICT, "panel user already exists", ex);
        }
        if (ex.hasStatus(429)) {
          return unavailable(operation, ex);
        }
        logger.warn("panel {} rejected request status={}", operation, ex.statusCode());
        return new PanelIntegrationException(
            PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE,
            "panel rejected request",
            ex);
      case INVALID_RESPONSE:
        logger.warn("panel {} returned unreadable response", operation);
        return new PanelIntegrationException(
            PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE,
            "panel response is invalid",
            ex);
      case TRANSIENT_NETWORK:
      case TIMEOUT:
      case SERVER_ERROR:
      case UNAUTHORIZED:
      case AUTHENTICATION:
      case CIRCUIT_OPEN:
        return unavailable(operation, ex);
      default:
        throw new IllegalStateException("unknown failure kind: " + ex.kind());
    }
  }

  private PanelIntegrationException unavailable(String operation, UpstreamCallException ex) {
    logger.warn("panel {} unavailable kind={}", operation, ex.kind());
    return new PanelIntegrationException(
        PanelIntegrationException.Reason.UPSTREAM_UNAVAILABLE, "panel is unavailable", ex);
  }

  private PanelUser toPanelUser(String operation, PanelUserResponse response) {
    if (response == null || isBlank(response.username()) || isBlank(response.status())) {
      logger.warn("panel {} response validation failed", operation);
      throw new PanelIntegrationException(
          PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE, "panel response is invalid");
    }
    final PanelUserStatus status =
        PanelUserStatus.fromWire(response.status())
            .orElseThrow(
                () -> {
                  logger.warn("panel {} returned unknown status={}", operation, response.status());
                  return new PanelIntegrationException(
                      PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE,
                      "panel user status is unknown");
                });
    final Long expire = response.expire();
    return new PanelUser(
        response.username(),
        response.dataLimit() == null ? 0L : response.dataLimit(),
        response.usedTraffic() == null ? 0L : response.usedTraffic(),
        expire == null || expire <= 0 ? null : Instant.ofEpochSecond(expire),
        status,
        response.subscriptionUrl());
  }

  private static Long toEpochSeconds(Instant instant) {
    return instant == null ? null : instant.getEpochSecond();
  }

  private static void requireUsername(String username) {
    if (username.isBlank()) {
      throw new IllegalArgumentException("username is required");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
