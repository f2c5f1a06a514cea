/*
 * どこで: Subscription パネル連携設定
 * 何を: パネル用 RestClient・リトライポリシー・サーキットブレーカー・試行用スレッドプールを組み立てる
 * なぜ: 接続プールとブレーカーをプロセス内で 1 つに共有するため
 */
package com.vpnbot.subscription.config;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vpnbot.subscription.auth.TokenManager;
import com.vpnbot.subscription.http.CircuitBreaker;
import com.vpnbot.subscription.http.PanelMetrics;
import com.vpnbot.subscription.http.ResilientHttpClient;
import com.vpnbot.subscription.http.RetryPolicy;
import com.vpnbot.subscription.http.Sleeper;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({PanelClientProperties.class, PanelResilienceProperties.class})
public class PanelClientConfig {

  static final String CIRCUIT_NAME = "panel";

  @Bean
  RestClient panelRestClient(RestClient.Builder builder, PanelClientProperties properties) {
    // JDK HttpClient はホスト単位で接続を再利用する。プロセスで 1 インスタンスを共有する
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }

  @Bean
  RetryPolicy panelRetryPolicy(PanelResilienceProperties properties) {
    return properties.toRetryPolicy();
  }

  @Bean
  CircuitBreaker panelCircuitBreaker(
      PanelResilienceProperties properties, Clock clock, PanelMetrics metrics) {
    final CircuitBreaker circuitBreaker =
        new CircuitBreaker(
            CIRCUIT_NAME,
            properties.failureThreshold(),
            properties.failureWindow(),
            properties.openDuration(),
            clock,
            metrics::recordCircuitTransition);
    metrics.registerCircuitState(circuitBreaker);
    return circuitBreaker;
  }

  @Bean(destroyMethod = "close")
  ResilientHttpClient panelHttpClient(
      RestClient panelRestClient,
      TokenManager tokenManager,
      CircuitBreaker panelCircuitBreaker,
      RetryPolicy panelRetryPolicy,
      PanelClientProperties properties,
      PanelMetrics metrics) {
    // 全体タイムアウト時に試行を放棄できるよう、各試行は専用スレッドで実行する
    final ExecutorService attemptExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("panel-http-%d").setDaemon(true).build());
    return new ResilientHttpClient(
        panelRestClient,
        tokenManager,
        panelCircuitBreaker,
        panelRetryPolicy,
        properties.callTimeout(),
        attemptExecutor,
        Sleeper.THREAD,
        Ticker.systemTicker(),
        metrics);
  }
}
