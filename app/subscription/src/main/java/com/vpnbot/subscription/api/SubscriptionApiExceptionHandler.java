/*
 * どこで: Subscription API
 * 何を: ドメイン例外とパネル連携例外を安定したエラーコードの応答へ変換する
 * なぜ: ボット側が通信詳細に触れずにコードだけで分岐できるようにするため
 */
package com.vpnbot.subscription.api;

import com.vpnbot.subscription.panel.PanelIntegrationException;
import com.vpnbot.subscription.service.SubscriptionAlreadyExistsException;
import com.vpnbot.subscription.service.SubscriptionNotFoundException;
import com.vpnbot.subscription.validation.SubscriptionValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class SubscriptionApiExceptionHandler {

  private static final Logger logger =
      LoggerFactory.getLogger(SubscriptionApiExceptionHandler.class);

  @ExceptionHandler(SubscriptionValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(SubscriptionValidationException ex) {
    return error(ApiErrorCode.VALIDATION_ERROR, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    return error(ApiErrorCode.VALIDATION_ERROR, "request validation failed");
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleUnreadableRequest(Exception ex) {
    return error(ApiErrorCode.VALIDATION_ERROR, "request is malformed");
  }

  @ExceptionHandler(SubscriptionAlreadyExistsException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyExists(
      SubscriptionAlreadyExistsException ex) {
    return error(ApiErrorCode.ALREADY_EXISTS, ex.getMessage());
  }

  @ExceptionHandler(SubscriptionNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(SubscriptionNotFoundException ex) {
    return error(ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(PanelIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handlePanelIntegration(PanelIntegrationException ex) {
    final ApiErrorCode code =
        switch (ex.reason()) {
          case NOT_FOUND -> ApiErrorCode.NOT_FOUND;
          case CONFLICT -> ApiErrorCode.CONFLICT;
          case UPSTREAM_UNAVAILABLE -> ApiErrorCode.UPSTREAM_UNAVAILABLE;
          case INVALID_UPSTREAM_RESPONSE -> ApiErrorCode.INTERNAL_ERROR;
        };
    if (code == ApiErrorCode.INTERNAL_ERROR) {
      logger.error("panel returned invalid response", ex);
    }
    // 下流の通信詳細は返さない
    return error(code, ex.getMessage());
  }

  private ResponseEntity<ApiErrorResponse> error(ApiErrorCode code, String message) {
    return ResponseEntity.status(code.status()).body(new ApiErrorResponse(code.name(), message));
  }
}
