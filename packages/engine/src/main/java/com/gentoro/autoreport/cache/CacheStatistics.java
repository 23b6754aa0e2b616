package com.gentoro.autoreport.cache;

/**
 * Counters since the cache was created.
 *
 * @param coalesced lookups that joined a computation still in flight for the same key
 */
public record CacheStatistics(long hits, long misses, long coalesced, int size) {

  /** Share of lookups served without a new computation. */
  public double hitRate() {
    long total = hits + misses + coalesced;
    return total == 0 ? 0.0 : (double) (hits + coalesced) / total;
  }
}
