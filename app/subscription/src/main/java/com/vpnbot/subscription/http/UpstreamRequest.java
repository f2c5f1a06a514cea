package com.vpnbot.subscription.http;

import java.util.Map;
import java.util.Objects;
import org.springframework.http.HttpMethod;

/**
 * パネルへの 1 論理呼び出し。
 *
 * <p>{@code responseType} が {@link Void} の場合は応答本文を読まない。
 */
public record UpstreamRequest<T>(
    String operation,
    HttpMethod method,
    String uriTemplate,
    Map<String, ?> uriVariables,
    Object body,
    Class<T> responseType) {

  public UpstreamRequest {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(uriTemplate, "uriTemplate");
    Objects.requireNonNull(responseType, "responseType");
    uriVariables = uriVariables == null ? Map.of() : Map.copyOf(uriVariables);
  }

  public static <T> UpstreamRequest<T> get(
      String operation, String uriTemplate, Map<String, ?> uriVariables, Class<T> responseType) {
    return new UpstreamRequest<>(
        operation, HttpMethod.GET, uriTemplate, uriVariables, null, responseType);
  }

  public static <T> UpstreamRequest<T> post(
      String operation, String uriTemplate, Object body, Class<T> responseType) {
    return new UpstreamRequest<>(operation, HttpMethod.POST, uriTemplate, null, body, responseType);
  }

  public static <T> UpstreamRequest<T> put(
      String operation,
      String uriTemplate,
      Map<String, ?> uriVariables,
      Object body,
      Class<T> responseType) {
    return new UpstreamRequest<>(
        operation, HttpMethod.PUT, uriTemplate, uriVariables, body, responseType);
  }

  public static UpstreamRequest<Void> delete(
      String operation, String uriTemplate, Map<String, ?> uriVariables) {
    return new UpstreamRequest<>(
        operation, HttpMethod.DELETE, uriTemplate, uriVariables, null, Void.class);
  }

  public boolean expectsBody() {
    return responseType != Void.class;
  }
}
