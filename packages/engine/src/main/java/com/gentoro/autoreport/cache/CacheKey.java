package com.gentoro.autoreport.cache;

import com.gentoro.autoreport.utility.HashUtility;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result cache key: the placeholder content hash plus what else decides its value, namely the data
 * source and the effective parameters (an inferred "本月" differs between documents).
 */
public record CacheKey(String contentHash, String dataSourceId, String parametersDigest) {

  public static CacheKey of(
      String contentHash, String dataSourceId, Map<String, String> parameters) {
    StringBuilder sb = new StringBuilder();
    new TreeMap<>(parameters).forEach((k, v) -> sb.append(k).append('=').append(v).append('\n'));
    return new CacheKey(contentHash, dataSourceId, HashUtility.sha256Hex(sb.toString()));
  }
}
