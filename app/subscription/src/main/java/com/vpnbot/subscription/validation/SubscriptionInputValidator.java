/*
 * どこで: Subscription 入力検証層
 * 何を: ユーザー ID・プラン選択・ボタンデータ・日数・通信量上限を検証して正規化する
 * なぜ: 不正入力をパネル呼び出し前に止め、フィールド単位のエラーを返すため
 */
package com.vpnbot.subscription.validation;

import com.vpnbot.subscription.config.SubscriptionProperties;
import com.vpnbot.subscription.model.CallbackPayload;
import com.vpnbot.subscription.model.PlanSelection;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class SubscriptionInputValidator {

  public static final int MIN_DAYS = 1;
  public static final int MAX_DAYS = 365;
  public static final long MIN_DATA_LIMIT = SubscriptionProperties.GIB;
  public static final long MAX_DATA_LIMIT = 10_240L * SubscriptionProperties.GIB;
  public static final int MAX_CALLBACK_LENGTH = 64;
  public static final Set<String> CALLBACK_ACTIONS =
      Set.of("trial", "status", "renew", "plan", "suspend", "activate");

  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern CALLBACK_ARGUMENT = Pattern.compile("[A-Za-z0-9_-]+");
  private static final String LONG_MAX_DIGITS = Long.toString(Long.MAX_VALUE);

  private final Map<String, SubscriptionProperties.Plan> plans;

  public SubscriptionInputValidator(SubscriptionProperties properties) {
    final Map<String, SubscriptionProperties.Plan> catalog = properties.plans();
    if (catalog == null || catalog.isEmpty()) {
      throw new IllegalStateException("plan catalog is not configured");
    }
    this.plans = Map.copyOf(catalog);
  }

  public ValidationResult<Long> validateUserId(String raw) {
    if (raw == null || raw.isBlank()) {
      return ValidationResult.invalid("user_id", "user_id is required");
    }
    final String trimmed = raw.trim();
    if (!DIGITS.matcher(trimmed).matches()) {
      return ValidationResult.invalid("user_id", "user_id must be a positive integer");
    }
    final String normalized = stripLeadingZeros(trimmed);
    if (normalized.isEmpty()) {
      return ValidationResult.invalid("user_id", "user_id must be a positive integer");
    }
    if (normalized.length() > LONG_MAX_DIGITS.length()
        || (normalized.length() == LONG_MAX_DIGITS.length()
            && normalized.compareTo(LONG_MAX_DIGITS) > 0)) {
      return ValidationResult.invalid("user_id", "user_id is out of range");
    }
    return ValidationResult.valid(Long.parseLong(normalized));
  }

  public ValidationResult<PlanSelection> validatePlanSelection(String raw) {
    if (raw == null || raw.isBlank()) {
      return ValidationResult.invalid("plan", "plan is required");
    }
    final String code = raw.trim();
    final SubscriptionProperties.Plan plan = plans.get(code);
    if (plan == null) {
      return ValidationResult.invalid("plan", "plan is unknown");
    }
    if (plan.days() < MIN_DAYS || plan.days() > MAX_DAYS) {
      return ValidationResult.invalid("plan", "plan days are out of range");
    }
    if (plan.dataLimit() < MIN_DATA_LIMIT || plan.dataLimit() > MAX_DATA_LIMIT) {
      return ValidationResult.invalid("plan", "plan data limit is out of range");
    }
    return ValidationResult.valid(
        new PlanSelection(code, plan.days(), plan.dataLimit(), plan.price()));
  }

  public ValidationResult<CallbackPayload> validateCallbackPayload(String raw) {
    if (raw == null || raw.isBlank()) {
      return ValidationResult.invalid("callback_data", "callback_data is required");
    }
    final String trimmed = raw.trim();
    if (trimmed.length() > MAX_CALLBACK_LENGTH) {
      return ValidationResult.invalid("callback_data", "callback_data is too long");
    }
    final int separator = trimmed.indexOf(':');
    final String action = separator < 0 ? trimmed : trimmed.substring(0, separator);
    if (!CALLBACK_ACTIONS.contains(action)) {
      return ValidationResult.invalid("callback_data", "callback action is unknown");
    }
    if (separator < 0) {
      return ValidationResult.valid(new CallbackPayload(action, null));
    }
    final String argument = trimmed.substring(separator + 1);
    if (!CALLBACK_ARGUMENT.matcher(argument).matches()) {
      return ValidationResult.invalid("callback_data", "callback argument is invalid");
    }
    return ValidationResult.valid(new CallbackPayload(action, argument));
  }

  public ValidationResult<Integer> validateRenewDays(String raw) {
    if (raw == null || raw.isBlank()) {
      return ValidationResult.invalid("days", "days is required");
    }
    final String trimmed = raw.trim();
    if (!DIGITS.matcher(trimmed).matches() || trimmed.length() > 9) {
      return ValidationResult.invalid("days", "days must be between 1 and 365");
    }
    return validateRenewDays(Integer.parseInt(trimmed));
  }

  public ValidationResult<Integer> validateRenewDays(int days) {
    if (days < MIN_DAYS || days > MAX_DAYS) {
      return ValidationResult.invalid("days", "days must be between 1 and 365");
    }
    return ValidationResult.valid(days);
  }

  public ValidationResult<Long> validateDataLimit(String raw) {
    if (raw == null || raw.isBlank()) {
      return ValidationResult.invalid("data_limit", "data_limit is required");
    }
    final String trimmed = raw.trim();
    if (!DIGITS.matcher(trimmed).matches() || trimmed.length() > 18) {
      return ValidationResult.invalid("data_limit", "data_limit is out of range");
    }
    return validateDataLimit(Long.parseLong(trimmed));
  }

  public ValidationResult<Long> validateDataLimit(long bytes) {
    if (bytes < MIN_DATA_LIMIT || bytes > MAX_DATA_LIMIT) {
      return ValidationResult.invalid("data_limit", "data_limit is out of range");
    }
    return ValidationResult.valid(bytes);
  }

  private static String stripLeadingZeros(String digits) {
    int index = 0;
    while (index < digits.length() && digits.charAt(index) == '0') {
      index++;
    }
    return digits.substring(index);
  }
}
