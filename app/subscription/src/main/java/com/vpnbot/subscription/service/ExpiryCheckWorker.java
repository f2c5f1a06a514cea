/*
 * どこで: Subscription 期限チェックワーカー
 * 何を: 期限切れ購読を定期的に expired へ更新し、期限間近の件数をログに残す
 * なぜ: ボット側の通知や再購入導線が保存レコードだけで判断できるようにするため
 */
package com.vpnbot.subscription.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "subscription.expiry.check-enabled", havingValue = "true")
public class ExpiryCheckWorker {

  private static final Logger logger = LoggerFactory.getLogger(ExpiryCheckWorker.class);

  private final SubscriptionService subscriptionService;

  @Scheduled(fixedDelayString = "${subscription.expiry.check-interval:PT1H}")
  public void run() {
    final int expired = subscriptionService.checkExpirations();
    final int expiring = subscriptionService.findExpiring().size();
    logger.info("expiry check finished expired={} expiringSoon={}", expired, expiring);
  }
}
