package com.gentoro.autoreport.cache;

import com.gentoro.autoreport.logging.LoggingService;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Shared cache of resolved values, keyed by {@link CacheKey}.
 *
 * <p>At most one computation runs per key: the first caller installs a future and computes on its
 * own thread, concurrent callers for the same key wait on that future. Results rejected by the
 * {@code cacheable} predicate, and computations that throw, are removed once complete so a later
 * call computes again. A waiter handed a result rejected by {@code shareable} (one that only means
 * something to the caller that produced it) computes its own instead.
 */
public class ResolutionCache<V> {
  private static final Logger log = LoggingService.getLogger(ResolutionCache.class);

  private final ConcurrentHashMap<CacheKey, CompletableFuture<V>> entries =
      new ConcurrentHashMap<>();
  private final Predicate<V> cacheable;
  private final Predicate<V> shareable;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong coalesced = new AtomicLong();

  public ResolutionCache() {
    this(v -> true);
  }

  public ResolutionCache(Predicate<V> cacheable) {
    this(cacheable, v -> true);
  }

  public ResolutionCache(Predicate<V> cacheable, Predicate<V> shareable) {
    this.cacheable = cacheable;
    this.shareable = shareable;
  }

  /**
   * Return the cached value for {@code key}, computing it at most once across callers.
   *
   * @throws CancellationException when the calling thread is interrupted while waiting on another
   *     caller's computation
   */
  public V getOrCompute(CacheKey key, Supplier<V> computation) {
    while (true) {
      CompletableFuture<V> mine = new CompletableFuture<>();
      CompletableFuture<V> existing = entries.putIfAbsent(key, mine);
      if (existing == null) {
        return compute(key, mine, computation);
      }
      if (existing.isDone()) {
        hits.incrementAndGet();
      } else {
        coalesced.incrementAndGet();
        log.debug("Joining in-flight resolution for {}", key.contentHash());
      }
      V value = await(existing);
      if (shareable.test(value)) {
        return value;
      }
      log.debug("In-flight resolution for {} was abandoned, computing again", key.contentHash());
    }
  }

  private V compute(CacheKey key, CompletableFuture<V> mine, Supplier<V> computation) {
    misses.incrementAndGet();
    try {
      V value = computation.get();
      // unshareable results are never left behind for waiters that arrive later
      if (!cacheable.test(value) || !shareable.test(value)) {
        entries.remove(key, mine);
      }
      mine.complete(value);
      return value;
    } catch (RuntimeException | Error e) {
      entries.remove(key, mine);
      mine.completeExceptionally(e);
      throw e;
    }
  }

  private static <V> V await(CompletableFuture<V> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for an in-flight resolution");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new CompletionException(cause);
    }
  }

  public void invalidate(CacheKey key) {
    entries.remove(key);
  }

  public void invalidateAll() {
    entries.clear();
  }

  public CacheStatistics statistics() {
    return new CacheStatistics(hits.get(), misses.get(), coalesced.get(), entries.size());
  }
}
