package io.intellixity.discover.governance.internal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache with expire-after-write.\n
 *
 * - LRU eviction: access-order LinkedHashMap bounded by maxEntries\n
 * - TTL: entries older than ttlMillis are reloaded (0 disables expiry)\n
 * - null values are never stored\n
 */
public final class ExpiringLruCache<K, V> {
  private final long ttlMillis;
  private final LongSupplier nowMillis;
  private final LinkedHashMap<K, Timestamped<V>> map;

  private record Timestamped<V>(V value, long writtenAt) {}

  public ExpiringLruCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.map = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<K, Timestamped<V>> eldest) {
        return size() > maxEntries;
      }
    };
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    Timestamped<V> e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, nowMillis.getAsLong())) {
      map.remove(key);
      return null;
    }
    return e.value();
  }

  /** Returns the live cached value or loads, stores and returns a new one. A null load is returned but not stored. */
  public synchronized V computeIfAbsent(K key, Function<K, V> loader) {
    Objects.requireNonNull(loader, "loader");
    V existing = get(key);
    if (existing != null) return existing;
    V created = loader.apply(key);
    if (created != null) map.put(key, new Timestamped<>(created, nowMillis.getAsLong()));
    return created;
  }

  public synchronized void remove(K key) {
    map.remove(key);
  }

  public synchronized int size() {
    long now = nowMillis.getAsLong();
    map.values().removeIf(e -> isExpired(e, now));
    return map.size();
  }

  private boolean isExpired(Timestamped<V> e, long now) {
    return ttlMillis > 0 && (now - e.writtenAt()) >= ttlMillis;
  }
}
