/*
 * どこで: Subscription 設定
 * 何を: トライアル既定値・プラン一覧・期限チェック設定を保持する
 * なぜ: 料金プランやトライアル条件をコード変更なしで差し替えるため
 */
package com.vpnbot.subscription.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "subscription")
public record SubscriptionProperties(Trial trial, Map<String, Plan> plans, Expiry expiry) {

  public static final long GIB = 1_073_741_824L;

  public SubscriptionProperties {
    trial = trial == null ? new Trial(null, null) : trial;
    plans = plans == null || plans.isEmpty() ? defaultPlans() : Map.copyOf(plans);
    expiry = expiry == null ? new Expiry(false, null, null) : expiry;
  }

  public record Trial(Long dataLimit, Integer expireDays) {

    public Trial {
      dataLimit = dataLimit == null ? 5 * GIB : dataLimit;
      expireDays = expireDays == null ? 3 : expireDays;
    }
  }

  public record Plan(int days, long dataLimit, long price) {}

  public record Expiry(boolean checkEnabled, Duration checkInterval, Duration warningWindow) {

    public Expiry {
      checkInterval = checkInterval == null ? Duration.ofHours(1) : checkInterval;
      warningWindow = warningWindow == null ? Duration.ofDays(3) : warningWindow;
    }
  }

  private static Map<String, Plan> defaultPlans() {
    final Map<String, Plan> plans = new LinkedHashMap<>();
    plans.put("1", new Plan(30, 100 * GIB, 300));
    plans.put("3", new Plan(90, 300 * GIB, 750));
    plans.put("6", new Plan(180, 600 * GIB, 1000));
    plans.put("12", new Plan(365, 1200 * GIB, 2000));
    return Map.copyOf(plans);
  }
}
