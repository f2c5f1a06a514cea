package com.vpnbot.subscription.cache;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "subscription.cache.sweep-enabled", havingValue = "true")
public class CacheSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(CacheSweepWorker.class);

  private final List<TtlCache<?, ?>> caches;

  @Scheduled(fixedDelayString = "${subscription.cache.sweep-interval:PT5M}")
  public void run() {
    int removed = 0;
    for (TtlCache<?, ?> cache : caches) {
      removed += cache.sweepExpired();
    }
    logger.debug("cache sweep finished caches={} removed={}", caches.size(), removed);
  }
}
