/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.whispersystems.serviceclient.util.ExceptionUtils;

/**
 * A handle to an in-flight asynchronous call. It resolves exactly once, to either a value or an exception;
 * {@link #await()} yields the same value or throws the same exception as the equivalent blocking call.
 */
public class FutureResult<T> {

  private final CompletableFuture<T> future;
  private final Runnable canceller;

  public FutureResult(final CompletableFuture<T> future, final Runnable canceller) {
    this.future = future;
    this.canceller = canceller;
  }

  public static <T> FutureResult<T> failed(final Throwable throwable) {
    return new FutureResult<>(CompletableFuture.failedFuture(throwable), () -> {});
  }

  /**
   * Blocks until the call resolves.
   *
   * @return the value of the call
   *
   * @throws ServiceClientException (or another unchecked exception) if the call failed
   * @throws CancellationException if the call was cancelled
   */
  public T await() {
    try {
      return future.join();
    } catch (final CompletionException e) {
      throw ExceptionUtils.rethrowUnwrapped(e);
    }
  }

  /**
   * Blocks until the call resolves or the given timeout elapses. Timing out does not cancel the call.
   */
  public T await(final Duration timeout) throws TimeoutException, InterruptedException {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final ExecutionException e) {
      throw ExceptionUtils.rethrowUnwrapped(e);
    }
  }

  /**
   * Attempts to cancel the call. Cancellation is best-effort: a request that has already reached the remote service
   * may still take effect.
   *
   * @return {@code true} if this handle was cancelled before it resolved
   */
  public boolean cancel() {
    // CompletableFuture.cancel reports isCancelled(), which stays true on repeated calls
    final boolean cancelled = !future.isDone() && future.cancel(true);

    if (cancelled) {
      canceller.run();
    }

    return cancelled;
  }

  public boolean isDone() {
    return future.isDone();
  }

  public boolean isCancelled() {
    return future.isCancelled();
  }

  /**
   * @return a handle that yields the result of applying the given function to this handle's value; cancelling it
   * cancels this call
   */
  public <U> FutureResult<U> then(final Function<? super T, ? extends U> fn) {
    return new FutureResult<>(future.thenApply(fn), this::cancel);
  }

  public CompletableFuture<T> toCompletableFuture() {
    return future;
  }
}
