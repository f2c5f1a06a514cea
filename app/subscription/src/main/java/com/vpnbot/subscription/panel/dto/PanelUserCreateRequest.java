package com.vpnbot.subscription.panel.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PanelUserCreateRequest(
    String username,
    Map<String, Map<String, Object>> proxies,
    long dataLimit,
    Long expire,
    String status) {

  /** VLESS プロキシのみを既定設定で有効化した作成リクエスト。 */
  public static PanelUserCreateRequest vless(
      String username, long dataLimit, Long expire, String status) {
    return new PanelUserCreateRequest(
        username, Map.of("vless", Map.of()), dataLimit, expire, status);
  }
}
