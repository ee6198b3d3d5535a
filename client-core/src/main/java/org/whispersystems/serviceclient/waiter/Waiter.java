/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.waiter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.serviceclient.Command;
import org.whispersystems.serviceclient.FutureResult;
import org.whispersystems.serviceclient.Result;
import org.whispersystems.serviceclient.ServiceClient;
import org.whispersystems.serviceclient.ServiceClientException;
import org.whispersystems.serviceclient.description.Acceptor;
import org.whispersystems.serviceclient.description.WaiterConfig;
import org.whispersystems.serviceclient.util.ExceptionUtils;

/**
 * Polls an operation until the outcome of a call matches one of a waiter's terminal acceptors.
 * <p>
 * Acceptors are evaluated in declaration order after every call and the first match decides what happens next: a
 * success acceptor completes the wait with the call's result, a failure acceptor fails it with a
 * {@link WaiterException}, and a retry acceptor schedules another attempt. A successful call that matches nothing is
 * retried; a failed call that matches nothing fails the wait with the call's own exception. Attempts are spaced by the
 * configured delay without blocking a thread, and the wait fails with a timeout once the attempt budget is spent.
 */
public class Waiter {

  private static final Logger logger = LoggerFactory.getLogger(Waiter.class);

  private final ServiceClient client;
  private final String name;
  private final Command command;
  private final WaiterConfig config;

  @Nullable
  private final ScheduledExecutorService scheduler;

  private final CompletableFuture<Result> promise = new CompletableFuture<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicInteger attempts = new AtomicInteger(0);
  private final AtomicReference<FutureResult<Result>> inFlight = new AtomicReference<>();

  /**
   * @param client the client that executes each poll
   * @param name the waiter's name; also the polled operation if the configuration names none
   * @param parameters the parameters of every poll
   * @param config the delay, attempt budget and acceptors of this wait
   * @param scheduler the executor on which delayed attempts are scheduled; if {@code null}, the common pool's delayed
   * executor is used
   *
   * @throws IllegalArgumentException if the service has no operation to poll
   */
  public Waiter(final ServiceClient client,
      final String name,
      final Map<String, ?> parameters,
      final WaiterConfig config,
      @Nullable final ScheduledExecutorService scheduler) {

    this.client = client;
    this.name = name;
    this.command = client.getCommand(config.operation() != null ? config.operation() : name, parameters);
    this.config = config;
    this.scheduler = scheduler;
  }

  /**
   * Makes the first attempt immediately and returns a handle to the outcome of the wait. Cancelling the handle stops
   * polling and cancels any call in flight. Calling this method more than once returns handles to the same wait.
   */
  public FutureResult<Result> start() {
    if (started.compareAndSet(false, true)) {
      poll();
    }

    return new FutureResult<>(promise, this::cancelInFlight);
  }

  private void poll() {
    if (promise.isDone()) {
      return;
    }

    final int attempt = attempts.incrementAndGet();
    logger.debug("Waiter {} making attempt {} of {}", name, attempt, config.maxAttempts());

    final FutureResult<Result> call;

    try {
      call = client.executeAsync(command);
    } catch (final RuntimeException e) {
      promise.completeExceptionally(e);
      return;
    }

    inFlight.set(call);

    call.toCompletableFuture().whenComplete((result, throwable) -> {
      try {
        evaluate(attempt, result, throwable == null ? null : ExceptionUtils.unwrap(throwable));
      } catch (final RuntimeException e) {
        promise.completeExceptionally(e);
      }
    });
  }

  private void evaluate(final int attempt, @Nullable final Result result, @Nullable final Throwable error) {
    // Calls cancelled along with the wait resolve after the promise; any other cancellation fails the wait
    if (promise.isDone()) {
      return;
    }

    final Optional<Acceptor> maybeAcceptor = config.acceptors().stream()
        .filter(acceptor -> matches(acceptor, result, error))
        .findFirst();

    if (maybeAcceptor.isEmpty() && error != null) {
      promise.completeExceptionally(error);
      return;
    }

    final Acceptor.State state = maybeAcceptor.map(Acceptor::state).orElse(Acceptor.State.RETRY);

    switch (state) {
      case SUCCESS -> promise.complete(result);

      case FAILURE -> promise.completeExceptionally(
          new WaiterException(WaiterException.Reason.FAILURE_STATE, name, attempt, result, error));

      case RETRY -> {
        if (attempt >= config.maxAttempts()) {
          logger.info("Waiter {} gave up after {} attempts", name, attempt);
          promise.completeExceptionally(
              new WaiterException(WaiterException.Reason.TIMEOUT, name, attempt, result, error));
        } else {
          scheduleNextAttempt();
        }
      }
    }
  }

  private void scheduleNextAttempt() {
    final long delayMillis = config.delay().toMillis();

    if (scheduler != null) {
      scheduler.schedule(this::poll, delayMillis, TimeUnit.MILLISECONDS);
    } else {
      CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS).execute(this::poll);
    }
  }

  private void cancelInFlight() {
    final FutureResult<Result> call = inFlight.get();

    if (call != null) {
      call.cancel();
    }
  }

  static boolean matches(final Acceptor acceptor, @Nullable final Result result, @Nullable final Throwable error) {
    return switch (acceptor.matcher()) {
      case PATH -> result != null && valuesEqual(result.search(acceptor.argument()), acceptor.expected());

      case PATH_ALL -> result != null
          && result.search(acceptor.argument()) instanceof List<?> values
          && !values.isEmpty()
          && values.stream().allMatch(value -> valuesEqual(value, acceptor.expected()));

      case PATH_ANY -> result != null
          && result.search(acceptor.argument()) instanceof List<?> values
          && values.stream().anyMatch(value -> valuesEqual(value, acceptor.expected()));

      case STATUS -> acceptor.expected() instanceof Number expectedStatus
          && statusCode(result, error) == expectedStatus.intValue();

      case ERROR -> error instanceof ServiceClientException serviceClientException
          && Objects.equals(serviceClientException.getErrorCode(), String.valueOf(acceptor.expected()));
    };
  }

  private static int statusCode(@Nullable final Result result, @Nullable final Throwable error) {
    if (result != null) {
      return result.getStatusCode().orElse(-1);
    }

    return error instanceof ServiceClientException serviceClientException
        ? serviceClientException.getStatusCode()
        : -1;
  }

  private static boolean valuesEqual(@Nullable final Object actual, final Object expected) {
    if (actual instanceof Number actualNumber && expected instanceof Number expectedNumber) {
      return Double.compare(actualNumber.doubleValue(), expectedNumber.doubleValue()) == 0;
    }

    return Objects.equals(actual, expected);
  }
}
