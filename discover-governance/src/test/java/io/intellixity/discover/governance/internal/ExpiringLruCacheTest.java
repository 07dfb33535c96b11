package io.intellixity.discover.governance.internal;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class ExpiringLruCacheTest {

  @Test
  void evictsLeastRecentlyUsed() {
    ExpiringLruCache<String, Integer> cache = new ExpiringLruCache<>(2, 0, () -> 0L);
    cache.computeIfAbsent("a", k -> 1);
    cache.computeIfAbsent("b", k -> 2);
    assertEquals(1, cache.get("a"));
    cache.computeIfAbsent("c", k -> 3);

    assertEquals(1, cache.get("a"));
    assertNull(cache.get("b"));
    assertEquals(3, cache.get("c"));
    assertEquals(2, cache.size());
  }

  @Test
  void expiresAfterWrite() {
    AtomicLong now = new AtomicLong();
    ExpiringLruCache<String, Integer> cache = new ExpiringLruCache<>(10, 100, now::get);
    cache.computeIfAbsent("a", k -> 1);
    now.set(99);
    assertEquals(1, cache.get("a"));
    now.set(100);
    assertNull(cache.get("a"));
    assertEquals(0, cache.size());
  }

  @Test
  void doesNotStoreNullLoads() {
    ExpiringLruCache<String, Integer> cache = new ExpiringLruCache<>(10, 0, () -> 0L);
    assertNull(cache.computeIfAbsent("a", k -> null));
    assertEquals(0, cache.size());
    assertEquals(7, cache.computeIfAbsent("a", k -> 7));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExpiringLruCache<String, Integer>(0, 0, () -> 0L));
    assertThrows(IllegalArgumentException.class, () -> new ExpiringLruCache<String, Integer>(1, -1, () -> 0L));
  }
}
