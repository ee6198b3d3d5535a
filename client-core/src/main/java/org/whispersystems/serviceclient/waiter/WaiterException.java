/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.waiter;

import java.util.Optional;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.Result;

/**
 * Indicates that a waiter stopped polling without reaching its success state.
 */
public class WaiterException extends RuntimeException {

  public enum Reason {
    /**
     * An acceptor with the failure state matched.
     */
    FAILURE_STATE,

    /**
     * The waiter exhausted its attempts without any terminal acceptor matching.
     */
    TIMEOUT
  }

  private final Reason reason;
  private final String waiterName;
  private final int attempts;

  @Nullable
  private final transient Result lastResult;

  public WaiterException(final Reason reason,
      final String waiterName,
      final int attempts,
      @Nullable final Result lastResult,
      @Nullable final Throwable lastError) {

    super(String.format(reason == Reason.TIMEOUT
            ? "Waiter %s timed out after %d attempts"
            : "Waiter %s entered a failure state after %d attempts", waiterName, attempts),
        lastError);

    this.reason = reason;
    this.waiterName = waiterName;
    this.attempts = attempts;
    this.lastResult = lastResult;
  }

  public Reason getReason() {
    return reason;
  }

  public String getWaiterName() {
    return waiterName;
  }

  public int getAttempts() {
    return attempts;
  }

  public Optional<Result> getLastResult() {
    return Optional.ofNullable(lastResult);
  }

  public Optional<Throwable> getLastError() {
    return Optional.ofNullable(getCause());
  }
}
