/*
 * どこで: Subscription サービス層
 * 何を: トライアル発行・状態照会・更新・停止/再開・削除・期限チェックをパネル連携と保存レコードで実現する
 * なぜ: ボット側の操作を検証済み入力と耐障害なパネル呼び出しの組み合わせに閉じ込めるため
 */
package com.vpnbot.subscription.service;

import com.google.common.util.concurrent.Striped;
import com.vpnbot.subscription.cache.CacheTtl;
import com.vpnbot.subscription.cache.TtlCache;
import com.vpnbot.subscription.config.SubscriptionCacheProperties;
import com.vpnbot.subscription.config.SubscriptionProperties;
import com.vpnbot.subscription.model.PlanSelection;
import com.vpnbot.subscription.model.SubscriptionRecord;
import com.vpnbot.subscription.model.SubscriptionStatus;
import com.vpnbot.subscription.model.SubscriptionStatusView;
import com.vpnbot.subscription.panel.PanelApiClient;
import com.vpnbot.subscription.panel.PanelIntegrationException;
import com.vpnbot.subscription.panel.PanelUser;
import com.vpnbot.subscription.panel.PanelUserStatus;
import com.vpnbot.subscription.panel.PanelUserUpdate;
import com.vpnbot.subscription.repository.SubscriptionRecordStore;
import com.vpnbot.subscription.validation.SubscriptionInputValidator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionService {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

  private static final int LOCK_STRIPES = 64;

  private final PanelApiClient panelApiClient;
  private final SubscriptionRecordStore recordStore;
  private final TtlCache<Long, SubscriptionStatusView> statusCache;
  private final SubscriptionInputValidator validator;
  private final SubscriptionProperties subscriptionProperties;
  private final SubscriptionCacheProperties cacheProperties;
  private final SubscriptionMetrics metrics;
  private final Clock clock;

  // ユーザー単位の更新を直列化する。同時 createTrial でパネルユーザーを二重作成しない
  private final Striped<Lock> userLocks = Striped.lazyWeakLock(LOCK_STRIPES);

  public SubscriptionStatusView createTrial(String rawUserId) {
    final long userId = requireUserId(rawUserId);
    return instrumented(
        "create_trial",
        () ->
            withUserLock(
                userId,
                () -> {
                  final Instant now = clock.instant();
                  final Optional<SubscriptionRecord> previous = recordStore.load(userId);
                  if (previous.isPresent()) {
                    if (!previous.get().isExpiredAt(now)) {
                      throw new SubscriptionAlreadyExistsException(userId);
                    }
                    // 期限切れのパネルユーザーは新しいユーザー名で作り直すので先に消す
                    deletePanelUser(userId, previous.get().panelUsername());
                  }
                  final SubscriptionProperties.Trial trial = subscriptionProperties.trial();
                  final String panelUsername = panelUsernameFor(userId, now);
                  final Instant expireAt = now.plus(Duration.ofDays(trial.expireDays()));
                  final PanelUser created =
                      panelApiClient.createUser(panelUsername, trial.dataLimit(), expireAt);
                  final SubscriptionRecord record =
                      toRecord(userId, created, expireAt, true, true, now);
                  recordStore.save(userId, record);
                  statusCache.invalidate(userId);
                  logger.info(
                      "trial created userId={} panelUsername={} expireAt={}",
                      userId,
                      record.panelUsername(),
                      record.expireAt());
                  return toView(record, now);
                }));
  }

  public SubscriptionStatusView getStatus(String rawUserId) {
    final long userId = requireUserId(rawUserId);
    return instrumented(
        "get_status",
        () -> {
          final SubscriptionRecord record =
              recordStore
                  .load(userId)
                  .orElseThrow(() -> new SubscriptionNotFoundException(userId));
          metrics.recordStatusLookup("request");
          final SubscriptionStatusView view =
              statusCache.getOrLoad(
                  userId, cacheProperties.ttlFor(CacheTtl.MEDIUM), () -> fetchStatus(record));
          return withCurrentStatus(view, clock.instant());
        });
  }

  public SubscriptionStatusView renew(String rawUserId, int days) {
    final long userId = requireUserId(rawUserId);
    final int validDays = validator.validateRenewDays(days).orElseThrow();
    return instrumented("renew", () -> extend(userId, validDays, null));
  }

  public SubscriptionStatusView renewWithPlan(String rawUserId, String planCode) {
    final long userId = requireUserId(rawUserId);
    final PlanSelection plan = validator.validatePlanSelection(planCode).orElseThrow();
    return instrumented("renew_plan", () -> extend(userId, plan.days(), plan.dataLimit()));
  }

  public SubscriptionStatusView suspend(String rawUserId) {
    final long userId = requireUserId(rawUserId);
    return instrumented("suspend", () -> changePanelStatus(userId, PanelUserStatus.DISABLED));
  }

  public SubscriptionStatusView activate(String rawUserId) {
    final long userId = requireUserId(rawUserId);
    return instrumented("activate", () -> changePanelStatus(userId, PanelUserStatus.ACTIVE));
  }

  public void remove(String rawUserId) {
    final long userId = requireUserId(rawUserId);
    instrumented(
        "remove",
        () ->
            withUserLock(
                userId,
                () -> {
                  final SubscriptionRecord record =
                      recordStore
                          .load(userId)
                          .orElseThrow(() -> new SubscriptionNotFoundException(userId));
                  deletePanelUser(userId, record.panelUsername());
                  recordStore.delete(userId);
                  statusCache.invalidate(userId);
                  logger.info("subscription removed userId={}", userId);
                  return null;
                }));
  }

  /** 保存レコードの利用量・上限・期限・状態をパネルの値で更新する。同期できなければ false。 */
  public boolean syncWithPanel(String rawUserId) {
    final long userId = requireUserId(rawUserId);
    return withUserLock(
        userId,
        () -> {
          final SubscriptionRecord record = recordStore.load(userId).orElse(null);
          if (record == null) {
            return false;
          }
          final PanelUser user;
          try {
            user = panelApiClient.getUser(record.panelUsername());
          } catch (PanelIntegrationException ex) {
            logger.warn("panel sync skipped userId={} reason={}", userId, ex.reason());
            metrics.recordOperation("sync", ex.reason().name().toLowerCase(Locale.ROOT));
            return false;
          }
          final Instant now = clock.instant();
          recordStore.save(
              userId, toRecord(userId, user, null, record.trial(), record.trialUsed(), now));
          statusCache.invalidate(userId);
          metrics.recordOperation("sync", "success");
          return true;
        });
  }

  /** 現在から {@code within} 以内に期限を迎える停止されていない購読。 */
  public List<SubscriptionRecord> findExpiring(Duration within) {
    if (within == null || within.isNegative()) {
      throw new IllegalArgumentException("within must not be negative");
    }
    final Instant now = clock.instant();
    return recordStore.findExpiringBetween(now, now.plus(within)).stream()
        .filter(r -> r.status() == SubscriptionStatus.ACTIVE)
        .toList();
  }

  public List<SubscriptionRecord> findExpiring() {
    return findExpiring(subscriptionProperties.expiry().warningWindow());
  }

  /** 期限を過ぎた有効レコードを expired に更新し、更新件数を返す。 */
  public int checkExpirations() {
    final Instant now = clock.instant();
    int changed = 0;
    for (SubscriptionRecord candidate : recordStore.findAll()) {
      if (candidate.status() != SubscriptionStatus.ACTIVE || !candidate.isExpiredAt(now)) {
        continue;
      }
      final boolean marked =
          withUserLock(
              candidate.userId(),
              () -> {
                final SubscriptionRecord current =
                    recordStore.load(candidate.userId()).orElse(null);
                if (current == null
                    || current.status() != SubscriptionStatus.ACTIVE
                    || !current.isExpiredAt(now)) {
                  return false;
                }
                recordStore.save(
                    current.userId(), current.withStatus(SubscriptionStatus.EXPIRED, now));
                statusCache.invalidate(current.userId());
                return true;
              });
      if (marked) {
        changed++;
      }
    }
    if (changed > 0) {
      logger.info("subscriptions marked expired count={}", changed);
    }
    metrics.recordExpiredMarked(changed);
    return changed;
  }

  private SubscriptionStatusView extend(long userId, int days, Long dataLimit) {
    return withUserLock(
        userId,
        () -> {
          final SubscriptionRecord record =
              recordStore.load(userId).orElseThrow(() -> new SubscriptionNotFoundException(userId));
          final PanelUser current = panelApiClient.getUser(record.panelUsername());
          final Instant now = clock.instant();
          final Instant currentExpiry =
              current.expireAt() != null ? current.expireAt() : record.expireAt();
          final Instant base =
              currentExpiry != null && currentExpiry.isAfter(now) ? currentExpiry : now;
          final Instant newExpiry = base.plus(Duration.ofDays(days));
          final PanelUser updated =
              panelApiClient.updateUser(
                  record.panelUsername(),
                  new PanelUserUpdate(dataLimit, newExpiry, PanelUserStatus.ACTIVE));
          final SubscriptionRecord renewed =
              toRecord(userId, updated, newExpiry, false, record.trialUsed(), now);
          recordStore.save(userId, renewed);
          statusCache.invalidate(userId);
          logger.info(
              "subscription renewed userId={} days={} expireAt={}", userId, days, newExpiry);
          return toView(renewed, now);
        });
  }

  private SubscriptionStatusView changePanelStatus(long userId, PanelUserStatus status) {
    return withUserLock(
        userId,
        () -> {
          final SubscriptionRecord record =
              recordStore.load(userId).orElseThrow(() -> new SubscriptionNotFoundException(userId));
          final PanelUser updated =
              panelApiClient.updateUser(record.panelUsername(), PanelUserUpdate.status(status));
          final Instant now = clock.instant();
          final SubscriptionRecord changed =
              toRecord(userId, updated, record.expireAt(), record.trial(), record.trialUsed(), now);
          recordStore.save(userId, changed);
          statusCache.invalidate(userId);
          logger.info("subscription status changed userId={} panelStatus={}", userId, status);
          return toView(changed, now);
        });
  }

  private SubscriptionStatusView fetchStatus(SubscriptionRecord record) {
    metrics.recordStatusLookup("panel");
    final PanelUser user = panelApiClient.getUser(record.panelUsername());
    final Instant now = clock.instant();
    return new SubscriptionStatusView(
        record.userId(),
        user.username(),
        statusOf(user, now),
        user.dataLimit(),
        user.usedTraffic(),
        user.expireAt(),
        user.subscriptionUrl());
  }

  /**
   * パネルが disabled なら DISABLED。期限前かつ通信量が上限未満なら ACTIVE、それ以外は EXPIRED。
   *
   * <p>上限 0 は無制限、期限 null は無期限として扱う。
   */
  static SubscriptionStatus statusOf(PanelUser user, Instant now) {
    if (user.status() == PanelUserStatus.DISABLED) {
      return SubscriptionStatus.DISABLED;
    }
    return usageStatus(user.expireAt(), user.dataLimit(), user.usedTraffic(), now);
  }

  /** キャッシュ済みの表示は取得時点の状態を持つので、返す時点の時刻で判定し直す。 */
  static SubscriptionStatusView withCurrentStatus(SubscriptionStatusView view, Instant now) {
    if (view.status() == SubscriptionStatus.DISABLED) {
      return view;
    }
    final SubscriptionStatus current =
        usageStatus(view.expireAt(), view.dataLimit(), view.usedTraffic(), now);
    if (current == view.status()) {
      return view;
    }
    return new SubscriptionStatusView(
        view.userId(),
        view.panelUsername(),
        current,
        view.dataLimit(),
        view.usedTraffic(),
        view.expireAt(),
        view.subscriptionUrl());
  }

  private static SubscriptionStatus usageStatus(
      Instant expireAt, long dataLimit, long usedTraffic, Instant now) {
    final boolean withinExpiry = expireAt == null || now.isBefore(expireAt);
    final boolean withinLimit = dataLimit <= 0 || usedTraffic < dataLimit;
    return withinExpiry && withinLimit ? SubscriptionStatus.ACTIVE : SubscriptionStatus.EXPIRED;
  }

  private void deletePanelUser(long userId, String panelUsername) {
    try {
      panelApiClient.deleteUser(panelUsername);
    } catch (PanelIntegrationException ex) {
      if (ex.reason() != PanelIntegrationException.Reason.NOT_FOUND) {
        throw ex;
      }
      logger.info(
          "panel user already absent userId={} panelUsername={}", userId, panelUsername);
    }
  }

  private SubscriptionRecord toRecord(
      long userId,
      PanelUser user,
      Instant fallbackExpiry,
      boolean trial,
      boolean trialUsed,
      Instant now) {
    final Instant expireAt = user.expireAt() != null ? user.expireAt() : fallbackExpiry;
    final PanelUser effective =
        new PanelUser(
            user.username(),
            user.dataLimit(),
            user.usedTraffic(),
            expireAt,
            user.status(),
            user.subscriptionUrl());
    return new SubscriptionRecord(
        userId,
        user.username(),
        user.dataLimit(),
        user.usedTraffic(),
        expireAt,
        statusOf(effective, now),
        user.subscriptionUrl(),
        trial,
        trialUsed,
        now);
  }

  private SubscriptionStatusView toView(SubscriptionRecord record, Instant now) {
    final SubscriptionStatus status =
        record.status() == SubscriptionStatus.DISABLED
            ? SubscriptionStatus.DISABLED
            : record.isExpiredAt(now) ? SubscriptionStatus.EXPIRED : SubscriptionStatus.ACTIVE;
    return new SubscriptionStatusView(
        record.userId(),
        record.panelUsername(),
        status,
        record.dataLimit(),
        record.usedTraffic(),
        record.expireAt(),
        record.subscriptionUrl());
  }

  private long requireUserId(String rawUserId) {
    return validator.validateUserId(rawUserId).orElseThrow();
  }

  static String panelUsernameFor(long userId, Instant now) {
    return "user_" + userId + "_" + now.getEpochSecond();
  }

  private <T> T withUserLock(long userId, Supplier<T> action) {
    final Lock lock = userLocks.get(userId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private <T> T instrumented(String operation, Supplier<T> action) {
    try {
      final T result = action.get();
      metrics.recordOperation(operation, "success");
      return result;
    } catch (SubscriptionAlreadyExistsException ex) {
      metrics.recordOperation(operation, "already_exists");
      throw ex;
    } catch (SubscriptionNotFoundException ex) {
      metrics.recordOperation(operation, "not_found");
      throw ex;
    } catch (PanelIntegrationException ex) {
      metrics.recordOperation(operation, "panel_" + ex.reason().name().toLowerCase(Locale.ROOT));
      throw ex;
    }
  }
}
