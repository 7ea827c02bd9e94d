package com.codeheadsystems.sessionstore.server;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for {@link java.util.concurrent.CompletableFuture} failures.
 */
public final class Futures {

  private Futures() {
  }

  /**
   * Strips the {@link CompletionException}/{@link ExecutionException} wrappers that
   * dependent stages add around the original failure.
   *
   * @param error the error
   * @return the underlying cause
   */
  public static Throwable unwrap(final Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
