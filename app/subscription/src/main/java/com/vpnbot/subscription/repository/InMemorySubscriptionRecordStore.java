package com.vpnbot.subscription.repository;

import com.vpnbot.subscription.model.SubscriptionRecord;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySubscriptionRecordStore implements SubscriptionRecordStore {

  private final ConcurrentMap<Long, SubscriptionRecord> records = new ConcurrentHashMap<>();

  @Override
  public Optional<SubscriptionRecord> load(long userId) {
    return Optional.ofNullable(records.get(userId));
  }

  @Override
  public void save(long userId, SubscriptionRecord record) {
    Objects.requireNonNull(record, "record");
    if (record.userId() != userId) {
      throw new IllegalArgumentException("record userId does not match key");
    }
    records.put(userId, record);
  }

  @Override
  public void delete(long userId) {
    records.remove(userId);
  }

  @Override
  public List<SubscriptionRecord> findExpiringBetween(Instant from, Instant to) {
    return records.values().stream()
        .filter(r -> r.expireAt() != null)
        .filter(r -> !r.expireAt().isBefore(from) && r.expireAt().isBefore(to))
        .sorted(Comparator.comparing(SubscriptionRecord::expireAt))
        .toList();
  }

  @Override
  public List<SubscriptionRecord> findAll() {
    return List.copyOf(records.values());
  }
}
