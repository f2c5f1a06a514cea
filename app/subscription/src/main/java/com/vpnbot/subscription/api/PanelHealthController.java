package com.vpnbot.subscription.api;

import com.vpnbot.subscription.api.response.PanelHealthResponse;
import com.vpnbot.subscription.panel.PanelApiClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PanelHealthController {

  private final PanelApiClient panelApiClient;

  @GetMapping("/v1/panel/health")
  public ResponseEntity<PanelHealthResponse> health() {
    return ResponseEntity.ok(new PanelHealthResponse(panelApiClient.healthCheck() ? "UP" : "DOWN"));
  }
}
