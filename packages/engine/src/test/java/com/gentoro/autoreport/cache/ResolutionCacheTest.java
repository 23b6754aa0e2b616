package com.gentoro.autoreport.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class ResolutionCacheTest {

  private static final CacheKey KEY = CacheKey.of("abc", "retail", Map.of("时间范围", "2024-01"));

  @Test
  void keyDependsOnDataSourceAndParameters() {
    assertEquals(KEY, CacheKey.of("abc", "retail", Map.of("时间范围", "2024-01")));
    assertNotEquals(KEY, CacheKey.of("abc", "warehouse", Map.of("时间范围", "2024-01")));
    assertNotEquals(KEY, CacheKey.of("abc", "retail", Map.of("时间范围", "2024-02")));
    assertEquals(
        CacheKey.of("abc", "retail", Map.of("a", "1", "b", "2")),
        CacheKey.of("abc", "retail", Map.of("b", "2", "a", "1")));
  }

  @Test
  void secondLookupIsHit() {
    ResolutionCache<String> cache = new ResolutionCache<>();
    AtomicInteger calls = new AtomicInteger();

    Supplier<String> compute =
        () -> {
          calls.incrementAndGet();
          return "v";
        };

    assertEquals("v", cache.getOrCompute(KEY, compute));
    assertEquals("v", cache.getOrCompute(KEY, compute));

    assertEquals(1, calls.get());
    CacheStatistics stats = cache.statistics();
    assertEquals(1, stats.hits());
    assertEquals(1, stats.misses());
    assertEquals(1, stats.size());
    assertEquals(0.5, stats.hitRate(), 1e-9);
  }

  @Test
  @Timeout(10)
  void concurrentLookupsComputeOnce() throws Exception {
    ResolutionCache<Integer> cache = new ResolutionCache<>();
    AtomicInteger calls = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  return cache.getOrCompute(
                      KEY,
                      () -> {
                        calls.incrementAndGet();
                        sleep(200);
                        return 42;
                      });
                }));
      }
      start.countDown();
      for (Future<Integer> f : futures) {
        assertEquals(42, f.get(5, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, calls.get());
    CacheStatistics stats = cache.statistics();
    assertEquals(1, stats.misses());
    assertEquals(7, stats.hits() + stats.coalesced());
  }

  @Test
  void rejectedResultsAreNotStored() {
    ResolutionCache<String> cache = new ResolutionCache<>(v -> !v.startsWith("failed"));
    AtomicInteger calls = new AtomicInteger();

    cache.getOrCompute(KEY, () -> "failed " + calls.incrementAndGet());
    String second = cache.getOrCompute(KEY, () -> "failed " + calls.incrementAndGet());

    assertEquals("failed 2", second);
    assertEquals(2, calls.get());
    assertEquals(0, cache.statistics().size());
  }

  @Test
  void failedComputationIsRetried() {
    ResolutionCache<String> cache = new ResolutionCache<>();
    assertThrows(
        IllegalStateException.class,
        () ->
            cache.getOrCompute(
                KEY,
                () -> {
                  throw new IllegalStateException("boom");
                }));
    assertEquals("ok", cache.getOrCompute(KEY, () -> "ok"));
  }

  @Test
  @Timeout(10)
  void waiterRecomputesWhenOwnerResultIsNotShareable() throws Exception {
    ResolutionCache<String> cache =
        new ResolutionCache<>(v -> v.equals("ok"), v -> !v.equals("cancelled"));
    CountDownLatch ownerStarted = new CountDownLatch(1);
    CountDownLatch releaseOwner = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<String> owner =
          pool.submit(
              () ->
                  cache.getOrCompute(
                      KEY,
                      () -> {
                        ownerStarted.countDown();
                        await(releaseOwner);
                        return "cancelled";
                      }));
      assertTrue(ownerStarted.await(5, TimeUnit.SECONDS));
      Future<String> waiter = pool.submit(() -> cache.getOrCompute(KEY, () -> "ok"));
      while (cache.statistics().coalesced() == 0) {
        Thread.sleep(5);
      }
      releaseOwner.countDown();

      assertEquals("cancelled", owner.get(5, TimeUnit.SECONDS));
      assertEquals("ok", waiter.get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    CacheStatistics stats = cache.statistics();
    assertEquals(2, stats.misses());
    assertEquals(1, stats.size());
    assertEquals("ok", cache.getOrCompute(KEY, () -> "again"));
  }

  @Test
  @Timeout(10)
  void interruptedWaiterStopsWaiting() throws Exception {
    ResolutionCache<String> cache = new ResolutionCache<>();
    CountDownLatch ownerStarted = new CountDownLatch(1);
    CountDownLatch releaseOwner = new CountDownLatch(1);
    Thread owner =
        new Thread(
            () ->
                cache.getOrCompute(
                    KEY,
                    () -> {
                      ownerStarted.countDown();
                      await(releaseOwner);
                      return "v";
                    }));
    owner.start();
    assertTrue(ownerStarted.await(5, TimeUnit.SECONDS));

    AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread waiter =
        new Thread(
            () -> {
              try {
                cache.getOrCompute(KEY, () -> "unused");
              } catch (Throwable t) {
                failure.set(t);
              }
            });
    waiter.start();
    while (cache.statistics().coalesced() == 0) {
      Thread.sleep(5);
    }
    waiter.interrupt();
    waiter.join(5_000);

    assertFalse(waiter.isAlive());
    assertInstanceOf(CancellationException.class, failure.get());
    releaseOwner.countDown();
    owner.join(5_000);
    assertEquals("v", cache.getOrCompute(KEY, () -> "unused"));
  }

  @Test
  void invalidate() {
    ResolutionCache<String> cache = new ResolutionCache<>();
    cache.getOrCompute(KEY, () -> "first");
    cache.invalidate(KEY);
    assertEquals("second", cache.getOrCompute(KEY, () -> "second"));

    cache.invalidateAll();
    assertEquals(0, cache.statistics().size());
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
