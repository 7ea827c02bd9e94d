package com.codeheadsystems.sessionstore.server.store;

import com.codeheadsystems.sessionstore.server.Futures;
import java.util.concurrent.CompletableFuture;

/**
 * Completion callback used by host frameworks: invoked once with either an error or a result.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface SessionCallback<T> {

  /**
   * Called when the operation completes.
   *
   * @param error  the failure, {@code null} on success
   * @param result the result, {@code null} on failure
   */
  void onComplete(Throwable error, T result);

  /**
   * Routes the outcome of a future to a callback. The callback sees the underlying cause,
   * never a {@link java.util.concurrent.CompletionException}.
   *
   * @param <T>      the result type
   * @param future   the future
   * @param callback the callback, may be {@code null}
   * @return the future observed by the callback
   */
  static <T> CompletableFuture<T> bind(final CompletableFuture<T> future,
                                       final SessionCallback<? super T> callback) {
    if (callback == null) {
      return future;
    }
    return future.whenComplete((result, error) -> {
      if (error != null) {
        callback.onComplete(Futures.unwrap(error), null);
      } else {
        callback.onComplete(null, result);
      }
    });
  }
}
