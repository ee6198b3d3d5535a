/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ExceptionUtils {

  private ExceptionUtils() {
    // utility class
  }

  /**
   * Extracts the cause of a {@link CompletionException} or {@link ExecutionException}. Wrapper exceptions are peeled
   * off one at a time until the first cause that is not a wrapper is found. A wrapper with a {@code null} cause is
   * returned as-is. Any other {@code throwable} is returned unchanged.
   *
   * @param throwable the throwable to "unwrap"
   * @return the first entity in the given {@code throwable}'s causal chain that is not a future wrapper
   */
  public static Throwable unwrap(Throwable throwable) {
    while ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
        && throwable.getCause() != null) {
      throwable = throwable.getCause();
    }
    return throwable;
  }

  /**
   * Wraps the given {@code throwable} in a {@link CompletionException} unless the given {@code throwable} is already a
   * {@code CompletionException}, in which case this method returns the original throwable.
   *
   * @param throwable the throwable to wrap in a {@code CompletionException}
   */
  public static CompletionException wrap(final Throwable throwable) {
    return throwable instanceof CompletionException completionException
        ? completionException
        : new CompletionException(throwable);
  }

  /**
   * Rethrows the unwrapped cause of a failed future on the calling thread. Unchecked causes are thrown directly so
   * that blocking callers observe the same exception types as asynchronous ones; checked causes are wrapped in a
   * {@link CompletionException}.
   *
   * @param throwable the failure of a future
   * @return never returns normally; declared so callers can write {@code throw rethrowUnwrapped(e)}
   */
  public static RuntimeException rethrowUnwrapped(final Throwable throwable) {
    final Throwable unwrapped = unwrap(throwable);

    if (unwrapped instanceof RuntimeException runtimeException) {
      throw runtimeException;
    }

    if (unwrapped instanceof Error error) {
      throw error;
    }

    throw new CompletionException(unwrapped);
  }
}
