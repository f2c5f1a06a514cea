/*
 * どこで: Subscription API
 * 何を: ボットプロセス向けに購読操作を HTTP で公開する
 * なぜ: ボット側からパネル連携と耐障害処理を切り離して呼べるようにするため
 */
package com.vpnbot.subscription.api;

import com.vpnbot.subscription.api.request.RenewRequest;
import com.vpnbot.subscription.api.response.ExpiringSubscriptionResponse;
import com.vpnbot.subscription.api.response.SubscriptionStatusResponse;
import com.vpnbot.subscription.api.response.SyncResponse;
import com.vpnbot.subscription.model.SubscriptionStatusView;
import com.vpnbot.subscription.service.SubscriptionService;
import com.vpnbot.subscription.validation.FieldError;
import com.vpnbot.subscription.validation.SubscriptionValidationException;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

  private static final int MAX_WITHIN_DAYS = 365;

  private final SubscriptionService subscriptionService;

  @PostMapping("/{user_id}/trial")
  public ResponseEntity<SubscriptionStatusResponse> createTrial(
      @PathVariable("user_id") String userId) {
    final SubscriptionStatusView view = subscriptionService.createTrial(userId);
    return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionStatusResponse.from(view));
  }

  @GetMapping("/{user_id}/status")
  public ResponseEntity<SubscriptionStatusResponse> getStatus(
      @PathVariable("user_id") String userId) {
    final SubscriptionStatusView view = subscriptionService.getStatus(userId);
    return ResponseEntity.ok(SubscriptionStatusResponse.from(view));
  }

  @PostMapping("/{user_id}/renew")
  public ResponseEntity<SubscriptionStatusResponse> renew(
      @PathVariable("user_id") String userId, @Valid @RequestBody RenewRequest request) {
    final boolean hasDays = request.days() != null;
    final boolean hasPlan = request.plan() != null && !request.plan().isBlank();
    if (hasDays == hasPlan) {
      throw new SubscriptionValidationException(
          new FieldError("days", "exactly one of days or plan is required"));
    }
    final SubscriptionStatusView view =
        hasDays
            ? subscriptionService.renew(userId, request.days())
            : subscriptionService.renewWithPlan(userId, request.plan());
    return ResponseEntity.ok(SubscriptionStatusResponse.from(view));
  }

  @PostMapping("/{user_id}/suspend")
  public ResponseEntity<SubscriptionStatusResponse> suspend(
      @PathVariable("user_id") String userId) {
    return ResponseEntity.ok(SubscriptionStatusResponse.from(subscriptionService.suspend(userId)));
  }

  @PostMapping("/{user_id}/activate")
  public ResponseEntity<SubscriptionStatusResponse> activate(
      @PathVariable("user_id") String userId) {
    return ResponseEntity.ok(SubscriptionStatusResponse.from(subscriptionService.activate(userId)));
  }

  @PostMapping("/{user_id}/sync")
  public ResponseEntity<SyncResponse> sync(@PathVariable("user_id") String userId) {
    return ResponseEntity.ok(new SyncResponse(subscriptionService.syncWithPanel(userId)));
  }

  @DeleteMapping("/{user_id}")
  public ResponseEntity<Void> remove(@PathVariable("user_id") String userId) {
    subscriptionService.remove(userId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/expiring")
  public ResponseEntity<List<ExpiringSubscriptionResponse>> findExpiring(
      @RequestParam(name = "within_days", required = false) Integer withinDays) {
    if (withinDays != null && (withinDays < 0 || withinDays > MAX_WITHIN_DAYS)) {
      throw new SubscriptionValidationException(
          new FieldError("within_days", "within_days must be between 0 and 365"));
    }
    final var records =
        withinDays == null
            ? subscriptionService.findExpiring()
            : subscriptionService.findExpiring(Duration.ofDays(withinDays));
    return ResponseEntity.ok(records.stream().map(ExpiringSubscriptionResponse::from).toList());
  }
}
