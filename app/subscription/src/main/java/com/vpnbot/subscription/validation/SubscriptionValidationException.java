package com.vpnbot.subscription.validation;

public class SubscriptionValidationException extends RuntimeException {

  private final FieldError fieldError;

  public SubscriptionValidationException(FieldError fieldError) {
    super(fieldError.field() + ": " + fieldError.message());
    this.fieldError = fieldError;
  }

  public FieldError fieldError() {
    return fieldError;
  }
}
