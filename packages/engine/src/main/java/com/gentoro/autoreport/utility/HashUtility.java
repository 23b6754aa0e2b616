package com.gentoro.autoreport.utility;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** SHA-256 helpers used for content-derived cache keys. */
public final class HashUtility {

  private HashUtility() {}

  /** @return lowercase hex SHA-256 digest of the UTF-8 bytes of {@code text} */
  public static String sha256Hex(String text) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      byte[] digest = md.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(digest.length * 2);
      for (byte b : digest) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      // SHA-256 is mandatory on every JVM
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
