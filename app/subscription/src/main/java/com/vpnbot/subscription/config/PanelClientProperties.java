/*
 * どこで: Subscription 設定
 * 何を: パネル API の接続先・認証情報・タイムアウトを保持する
 * なぜ: 環境ごとの接続先とタイムアウトを外部化するため
 */
package com.vpnbot.subscription.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "panel")
public record PanelClientProperties(
    String baseUrl,
    String username,
    String password,
    String tokenPath,
    String usersPath,
    String userPath,
    Duration connectTimeout,
    Duration readTimeout,
    Duration callTimeout,
    Duration tokenFallbackTtl,
    Duration tokenRefreshSkew) {

  public PanelClientProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank() ? "http://marzban:8000" : stripTrailingSlash(baseUrl);
    username = username == null ? "" : username;
    password = password == null ? "" : password;
    tokenPath = tokenPath == null || tokenPath.isBlank() ? "/api/admin/token" : tokenPath;
    usersPath = usersPath == null || usersPath.isBlank() ? "/api/user" : usersPath;
    userPath = userPath == null || userPath.isBlank() ? "/api/user/{username}" : userPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    callTimeout = callTimeout == null ? Duration.ofSeconds(30) : callTimeout;
    tokenFallbackTtl = tokenFallbackTtl == null ? Duration.ofHours(1) : tokenFallbackTtl;
    tokenRefreshSkew = tokenRefreshSkew == null ? Duration.ofSeconds(30) : tokenRefreshSkew;
  }

  @Override
  public String toString() {
    // password をログへ出さない
    return "PanelClientProperties[baseUrl="
        + baseUrl
        + ", username="
        + username
        + ", callTimeout="
        + callTimeout
        + "]";
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
