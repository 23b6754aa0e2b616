package com.gentoro.autoreport.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is an {@link
   * AutoReportException}, its code and context are preserved. Wrappers produced by futures are
   * unwrapped first.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable root = unwrap(t);
    if (root instanceof AutoReportException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        root == null ? "Unknown" : root.getClass().getSimpleName(),
        root == null ? "" : safeMessage(root.getMessage()),
        AutoReportErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Strip {@link CompletionException} and {@link ExecutionException} wrappers. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Extract a user-facing message from a throwable. Engine exceptions keep their own message;
   * anything else is prefixed with its simple class name.
   */
  public static String extractErrorMessage(Throwable t) {
    Throwable root = unwrap(t);
    if (root == null) {
      return "Unknown error";
    }
    String message = root.getMessage();
    if (message == null || message.isBlank()) {
      return root.getClass().getSimpleName();
    }
    if (root instanceof AutoReportException) {
      return message;
    }
    return root.getClass().getSimpleName() + ": " + message;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
