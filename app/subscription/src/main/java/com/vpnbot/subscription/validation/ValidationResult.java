package com.vpnbot.subscription.validation;

import java.util.Objects;
import java.util.Optional;

/** 正規化済みの値か {@link FieldError} のどちらか一方を持つ検証結果。 */
public final class ValidationResult<T> {

  private final T value;
  private final FieldError error;

  private ValidationResult(T value, FieldError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> ValidationResult<T> valid(T value) {
    return new ValidationResult<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> ValidationResult<T> invalid(String field, String message) {
    return new ValidationResult<>(null, new FieldError(field, message));
  }

  public boolean isValid() {
    return error == null;
  }

  public T value() {
    if (error != null) {
      throw new IllegalStateException("validation failed: " + error);
    }
    return value;
  }

  public Optional<FieldError> error() {
    return Optional.ofNullable(error);
  }

  public T orElseThrow() {
    if (error != null) {
      throw new SubscriptionValidationException(error);
    }
    return value;
  }

  @Override
  public String toString() {
    return isValid()
        ? "ValidationResult[value=" + value + "]"
        : "ValidationResult[error=" + error + "]";
  }
}
