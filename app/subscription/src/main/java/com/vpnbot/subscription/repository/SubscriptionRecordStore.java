package com.vpnbot.subscription.repository;

import com.vpnbot.subscription.model.SubscriptionRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** 外部ユーザー ID をキーとする購読レコードの保存先。同一プロセス内で read-your-writes を保証すること。 */
public interface SubscriptionRecordStore {

  Optional<SubscriptionRecord> load(long userId);

  void save(long userId, SubscriptionRecord record);

  void delete(long userId);

  /** {@code from} 以上 {@code to} 未満に期限を迎えるレコード。期限順。 */
  List<SubscriptionRecord> findExpiringBetween(Instant from, Instant to);

  List<SubscriptionRecord> findAll();
}
