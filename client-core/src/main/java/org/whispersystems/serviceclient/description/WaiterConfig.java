/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.description;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Describes how to poll an operation until it reaches a terminal state.
 *
 * @param operation the operation to poll; if {@code null}, the waiter's own name is used
 * @param delay the interval between attempts
 * @param maxAttempts the maximum number of calls before the waiter gives up
 * @param acceptors rules evaluated in order against each outcome; the first match wins
 */
public record WaiterConfig(@Nullable String operation, Duration delay, int maxAttempts, List<Acceptor> acceptors) {

  public WaiterConfig {
    Objects.requireNonNull(delay, "delay");

    if (delay.isNegative()) {
      throw new IllegalArgumentException("Waiter delay must not be negative");
    }

    if (maxAttempts < 1) {
      throw new IllegalArgumentException("Waiters must allow at least one attempt");
    }

    acceptors = acceptors == null ? List.of() : List.copyOf(acceptors);
  }

  public WaiterConfig withDelay(final Duration delay) {
    return new WaiterConfig(operation, delay, maxAttempts, acceptors);
  }

  public WaiterConfig withMaxAttempts(final int maxAttempts) {
    return new WaiterConfig(operation, delay, maxAttempts, acceptors);
  }

  public WaiterConfig withAcceptors(final List<Acceptor> acceptors) {
    return new WaiterConfig(operation, delay, maxAttempts, acceptors);
  }
}
