package com.vpnbot.subscription.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vpnbot.subscription.model.SubscriptionRecord;
import com.vpnbot.subscription.model.SubscriptionStatus;
import com.vpnbot.subscription.model.SubscriptionStatusView;
import com.vpnbot.subscription.panel.PanelIntegrationException;
import com.vpnbot.subscription.service.SubscriptionAlreadyExistsException;
import com.vpnbot.subscription.service.SubscriptionNotFoundException;
import com.vpnbot.subscription.service.SubscriptionService;
import com.vpnbot.subscription.validation.FieldError;
import com.vpnbot.subscription.validation.SubscriptionValidationException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SubscriptionController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(SubscriptionApiExceptionHandler.class)
class SubscriptionControllerTest {

  private static final Instant EXPIRE_AT = Instant.parse("2026-03-04T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SubscriptionService subscriptionService;

  @Test
  void createTrialReturns201() throws Exception {
    when(subscriptionService.createTrial("42")).thenReturn(view(SubscriptionStatus.ACTIVE));

    mockMvc
        .perform(post("/v1/subscriptions/42/trial").header("X-Request-Id", "req-1"))
        .andExpect(status().isCreated())
        .andExpect(header().string("X-Request-Id", "req-1"))
        .andExpect(jsonPath("$.user_id").value("42"))
        .andExpect(jsonPath("$.panel_username").value("user_42_1772323200"))
        .andExpect(jsonPath("$.status").value("active"))
        .andExpect(jsonPath("$.data_limit").value(5368709120L))
        .andExpect(jsonPath("$.expire_at").value("2026-03-04T00:00:00Z"));
  }

  @Test
  void createTrialReturns409WhenSubscriptionExists() throws Exception {
    when(subscriptionService.createTrial("42"))
        .thenThrow(new SubscriptionAlreadyExistsException(42L));

    mockMvc
        .perform(post("/v1/subscriptions/42/trial"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALREADY_EXISTS"));
  }

  @Test
  void invalidUserIdReturns400() throws Exception {
    when(subscriptionService.getStatus("abc"))
        .thenThrow(
            new SubscriptionValidationException(
                new FieldError("user_id", "user_id must be a positive integer")));

    mockMvc
        .perform(get("/v1/subscriptions/abc/status"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("user_id: user_id must be a positive integer"));
  }

  @Test
  void getStatusReturns404ForUnknownUser() throws Exception {
    when(subscriptionService.getStatus("7")).thenThrow(new SubscriptionNotFoundException(7L));

    mockMvc
        .perform(get("/v1/subscriptions/7/status"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void unavailablePanelReturns503() throws Exception {
    when(subscriptionService.getStatus("42"))
        .thenThrow(
            new PanelIntegrationException(
                PanelIntegrationException.Reason.UPSTREAM_UNAVAILABLE, "panel is unavailable"));

    mockMvc
        .perform(get("/v1/subscriptions/42/status"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("UPSTREAM_UNAVAILABLE"))
        .andExpect(jsonPath("$.message").value("panel is unavailable"));
  }

  @Test
  void invalidPanelResponseReturns502() throws Exception {
    when(subscriptionService.getStatus("42"))
        .thenThrow(
            new PanelIntegrationException(
                PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE,
                "panel response is invalid"));

    mockMvc
        .perform(get("/v1/subscriptions/42/status"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
  }

  @Test
  void renewWithDaysDelegatesToRenew() throws Exception {
    when(subscriptionService.renew("42", 30)).thenReturn(view(SubscriptionStatus.ACTIVE));

    mockMvc
        .perform(
            post("/v1/subscriptions/42/renew")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"days\":30}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"));
  }

  @Test
  void renewWithPlanDelegatesToRenewWithPlan() throws Exception {
    when(subscriptionService.renewWithPlan("42", "3")).thenReturn(view(SubscriptionStatus.ACTIVE));

    mockMvc
        .perform(
            post("/v1/subscriptions/42/renew")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"plan\":\"3\"}"))
        .andExpect(status().isOk());
    verify(subscriptionService).renewWithPlan("42", "3");
  }

  @Test
  void renewRequiresExactlyOneOfDaysOrPlan() throws Exception {
    mockMvc
        .perform(
            post("/v1/subscriptions/42/renew")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"days\":30,\"plan\":\"3\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("days: exactly one of days or plan is required"));
    mockMvc
        .perform(
            post("/v1/subscriptions/42/renew")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(subscriptionService);
  }

  @Test
  void renewRejectsOutOfRangeDaysBeforeService() throws Exception {
    mockMvc
        .perform(
            post("/v1/subscriptions/42/renew")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"days\":400}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request validation failed"));
    verifyNoInteractions(subscriptionService);
  }

  @Test
  void malformedBodyReturns400() throws Exception {
    mockMvc
        .perform(
            post("/v1/subscriptions/42/renew")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"days\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request is malformed"));
  }

  @Test
  void suspendAndActivateReturnUpdatedStatus() throws Exception {
    when(subscriptionService.suspend("42")).thenReturn(view(SubscriptionStatus.DISABLED));
    when(subscriptionService.activate("42")).thenReturn(view(SubscriptionStatus.ACTIVE));

    mockMvc
        .perform(post("/v1/subscriptions/42/suspend"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("disabled"));
    mockMvc
        .perform(post("/v1/subscriptions/42/activate"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"));
  }

  @Test
  void syncReportsResult() throws Exception {
    when(subscriptionService.syncWithPanel("42")).thenReturn(false);

    mockMvc
        .perform(post("/v1/subscriptions/42/sync"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.synced").value(false));
  }

  @Test
  void removeReturns204() throws Exception {
    mockMvc.perform(delete("/v1/subscriptions/42")).andExpect(status().isNoContent());
    verify(subscriptionService).remove("42");
  }

  @Test
  void removeOfUnknownUserReturns404() throws Exception {
    doThrow(new SubscriptionNotFoundException(42L)).when(subscriptionService).remove("42");

    mockMvc.perform(delete("/v1/subscriptions/42")).andExpect(status().isNotFound());
  }

  @Test
  void expiringListsSubscriptionsWithinWindow() throws Exception {
    when(subscriptionService.findExpiring(Duration.ofDays(3)))
        .thenReturn(
            List.of(
                new SubscriptionRecord(
                    42L,
                    "user_42_1772323200",
                    0L,
                    0L,
                    EXPIRE_AT,
                    SubscriptionStatus.ACTIVE,
                    null,
                    true,
                    true,
                    EXPIRE_AT)));

    mockMvc
        .perform(get("/v1/subscriptions/expiring").param("within_days", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].user_id").value("42"))
        .andExpect(jsonPath("$[0].expire_at").value("2026-03-04T00:00:00Z"))
        .andExpect(jsonPath("$[0].trial").value(true));
  }

  @Test
  void expiringWithoutWindowUsesDefault() throws Exception {
    when(subscriptionService.findExpiring()).thenReturn(List.of());

    mockMvc
        .perform(get("/v1/subscriptions/expiring"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isEmpty());
  }

  @Test
  void expiringRejectsOutOfRangeWindow() throws Exception {
    mockMvc
        .perform(get("/v1/subscriptions/expiring").param("within_days", "400"))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.message").value("within_days: within_days must be between 0 and 365"));
    mockMvc
        .perform(get("/v1/subscriptions/expiring").param("within_days", "soon"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request is malformed"));
    verify(subscriptionService, never()).findExpiring(any(Duration.class));
  }

  private static SubscriptionStatusView view(SubscriptionStatus status) {
    return new SubscriptionStatusView(
        42L,
        "user_42_1772323200",
        status,
        5_368_709_120L,
        0L,
        EXPIRE_AT,
        "https://sub/user_42_1772323200");
  }
}
