package com.vpnbot.subscription.panel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.http.HttpMethod.DELETE;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.HttpMethod.PUT;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.google.common.base.Ticker;
import com.vpnbot.subscription.auth.AuthenticationException;
import com.vpnbot.subscription.auth.Credential;
import com.vpnbot.subscription.auth.TokenManager;
import com.vpnbot.subscription.config.PanelClientProperties;
import com.vpnbot.subscription.http.CircuitBreaker;
import com.vpnbot.subscription.http.PanelMetrics;
import com.vpnbot.subscription.http.ResilientHttpClient;
import com.vpnbot.subscription.http.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class PanelApiClientTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final long GIB = 1_073_741_824L;
  private static final PanelClientProperties PROPERTIES =
      new PanelClientProperties(
          "http://panel.test", "admin", "secret", null, null, null, null, null, null, null, null);

  private MockRestServiceServer server;
  private TokenManager tokenManager;
  private ResilientHttpClient httpClient;
  private PanelApiClient client;

  @BeforeEach
  void setUp() {
    final RestClient.Builder builder = RestClient.builder().baseUrl(PROPERTIES.baseUrl());
    server = MockRestServiceServer.bindTo(builder).build();
    tokenManager = mock(TokenManager.class);
    when(tokenManager.getCredential()).thenReturn(new Credential("tok", NOW, null));
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final PanelMetrics metrics = new PanelMetrics(new SimpleMeterRegistry());
    httpClient =
        new ResilientHttpClient(
            builder.build(),
            tokenManager,
            new CircuitBreaker(
                "panel", 5, Duration.ofSeconds(60), Duration.ofSeconds(60), clock, null),
            new RetryPolicy(
                2, Duration.ZERO, 1.0d, Duration.ZERO, Duration.ZERO, null, null),
            Duration.ofSeconds(5),
            Executors.newCachedThreadPool(),
            duration -> {},
            Ticker.systemTicker(),
            metrics);
    client = new PanelApiClient(httpClient, tokenManager, PROPERTIES);
  }

  @AfterEach
  void tearDown() {
    httpClient.close();
  }

  @Test
  void createUserSendsVlessPayloadAndMapsResponse() {
    final Instant expireAt = NOW.plus(Duration.ofDays(3));
    server
        .expect(requestTo("http://panel.test/api/user"))
        .andExpect(method(POST))
        .andExpect(header("Authorization", "Bearer tok"))
        .andExpect(jsonPath("$.username").value("user_42_1772323200"))
        .andExpect(jsonPath("$.proxies.vless").exists())
        .andExpect(jsonPath("$.data_limit").value(5 * GIB))
        .andExpect(jsonPath("$.expire").value(expireAt.getEpochSecond()))
        .andExpect(jsonPath("$.status").value("active"))
        .andRespond(
            withSuccess(
                """
                {"username":"user_42_1772323200","data_limit":5368709120,"used_traffic":0,
                 "expire":1772582400,"status":"active","subscription_url":"https://sub/abc",
                 "links":["vless://x"]}
                """,
                MediaType.APPLICATION_JSON));

    final PanelUser user = client.createUser("user_42_1772323200", 5 * GIB, expireAt);

    assertThat(user.username()).isEqualTo("user_42_1772323200");
    assertThat(user.dataLimit()).isEqualTo(5 * GIB);
    assertThat(user.usedTraffic()).isZero();
    assertThat(user.expireAt()).isEqualTo(Instant.ofEpochSecond(1772582400L));
    assertThat(user.status()).isEqualTo(PanelUserStatus.ACTIVE);
    assertThat(user.subscriptionUrl()).isEqualTo("https://sub/abc");
    server.verify();
  }

  @Test
  void createUserConflictMapsToConflict() {
    server
        .expect(requestTo("http://panel.test/api/user"))
        .andRespond(withStatus(HttpStatus.CONFLICT));

    assertThatThrownBy(() -> client.createUser("user_1_1", GIB, NOW))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(PanelIntegrationException.Reason.CONFLICT));
  }

  @Test
  void getUserNotFoundMapsToNotFound() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andExpect(method(GET))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(PanelIntegrationException.Reason.NOT_FOUND));
  }

  @Test
  void getUserWithNullExpiryHasNoExpiry() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andRespond(
            withSuccess(
                """
                {"username":"user_1_1","data_limit":0,"used_traffic":10,"expire":null,
                 "status":"on_hold"}
                """,
                MediaType.APPLICATION_JSON));

    final PanelUser user = client.getUser("user_1_1");

    assertThat(user.expireAt()).isNull();
    assertThat(user.dataLimit()).isZero();
    assertThat(user.status()).isEqualTo(PanelUserStatus.ON_HOLD);
  }

  @Test
  void unknownStatusIsInvalidUpstreamResponse() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andRespond(
            withSuccess(
                "{\"username\":\"user_1_1\",\"status\":\"paused\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE));
  }

  @Test
  void missingUsernameIsInvalidUpstreamResponse() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andRespond(withSuccess("{\"status\":\"active\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE));
  }

  @Test
  void unreadableBodyIsInvalidUpstreamResponse() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andRespond(withSuccess("<html>oops</html>", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE));
  }

  @Test
  void otherClientErrorIsInvalidUpstreamResponse() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(PanelIntegrationException.Reason.INVALID_UPSTREAM_RESPONSE));
  }

  @Test
  void exhaustedServerErrorsMapToUpstreamUnavailable() {
    server
        .expect(ExpectedCount.times(2), requestTo("http://panel.test/api/user/user_1_1"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(PanelIntegrationException.Reason.UPSTREAM_UNAVAILABLE));
    server.verify();
  }

  @Test
  void unreachableTokenEndpointMapsToUpstreamUnavailableAfterRetries() {
    when(tokenManager.getCredential())
        .thenThrow(new AuthenticationException(true, "token endpoint unreachable"));

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(PanelIntegrationException.Reason.UPSTREAM_UNAVAILABLE));

    verify(tokenManager, times(2)).getCredential();
    server.verify();
  }

  @Test
  void rejectedAdminCredentialsMapToUpstreamUnavailable() {
    when(tokenManager.getCredential())
        .thenThrow(new AuthenticationException(false, "invalid admin credentials"));

    assertThatThrownBy(() -> client.getUser("user_1_1"))
        .isInstanceOfSatisfying(
            PanelIntegrationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(PanelIntegrationException.Reason.UPSTREAM_UNAVAILABLE));

    verify(tokenManager, times(1)).getCredential();
    server.verify();
  }

  @Test
  void updateUserSendsOnlyChangedFields() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andExpect(method(PUT))
        .andExpect(jsonPath("$.status").value("disabled"))
        .andExpect(jsonPath("$.data_limit").doesNotExist())
        .andExpect(jsonPath("$.expire").doesNotExist())
        .andRespond(
            withSuccess(
                "{\"username\":\"user_1_1\",\"status\":\"disabled\"}",
                MediaType.APPLICATION_JSON));

    final PanelUser user =
        client.updateUser("user_1_1", PanelUserUpdate.status(PanelUserStatus.DISABLED));

    assertThat(user.status()).isEqualTo(PanelUserStatus.DISABLED);
    server.verify();
  }

  @Test
  void updateUserRejectsEmptyUpdate() {
    assertThatThrownBy(() -> client.updateUser("user_1_1", new PanelUserUpdate(null, null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("update has no fields");
  }

  @Test
  void deleteUserSendsDelete() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andExpect(method(DELETE))
        .andRespond(withNoContent());

    client.deleteUser("user_1_1");

    server.verify();
  }

  @Test
  void getUserUsageSummarizesUser() {
    server
        .expect(requestTo("http://panel.test/api/user/user_1_1"))
        .andRespond(
            withSuccess(
                """
                {"username":"user_1_1","data_limit":100,"used_traffic":40,"expire":1772582400,
                 "status":"limited"}
                """,
                MediaType.APPLICATION_JSON));

    final PanelUserUsage usage = client.getUserUsage("user_1_1");

    assertThat(usage.usedTraffic()).isEqualTo(40L);
    assertThat(usage.dataLimit()).isEqualTo(100L);
    assertThat(usage.status()).isEqualTo(PanelUserStatus.LIMITED);
  }

  @Test
  void healthCheckDelegatesToTokenManager() {
    when(tokenManager.isAuthenticated()).thenReturn(true, false);

    assertThat(client.healthCheck()).isTrue();
    assertThat(client.healthCheck()).isFalse();
  }
}
