/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import static org.whispersystems.serviceclient.util.MetricsUtil.name;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.serviceclient.auth.CredentialsProvider;
import org.whispersystems.serviceclient.auth.Signer;
import org.whispersystems.serviceclient.configuration.ClientConfiguration;
import org.whispersystems.serviceclient.configuration.ClientResolver;
import org.whispersystems.serviceclient.description.PaginatorConfig;
import org.whispersystems.serviceclient.description.ServiceDescription;
import org.whispersystems.serviceclient.description.WaiterConfig;
import org.whispersystems.serviceclient.paginator.ResultPaginator;
import org.whispersystems.serviceclient.pipeline.RequestPipeline;
import org.whispersystems.serviceclient.pipeline.ResponseTranslator;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.util.ExceptionUtils;
import org.whispersystems.serviceclient.waiter.Waiter;

/**
 * A client for one remote service. Every operation of the service is invoked through the same pipeline: the
 * operation is looked up in the service description, a command is built with the client's default parameters, the
 * command is serialized, intercepted, signed and sent, and the outcome is parsed into a {@link Result} or translated
 * into a {@link ServiceClientException}.
 * <p>
 * Clients are thread-safe. Each call gets its own {@link Transaction}; the only state shared between calls is the
 * immutable configuration and the signer, both resolved at construction.
 */
public class ServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(ServiceClient.class);

  private static final String EXECUTE_TIMER_NAME = name(ServiceClient.class, "execute");

  private final ClientConfiguration configuration;
  private final Signer signer;
  private final RequestPipeline pipeline;
  private final ResponseTranslator translator;

  /**
   * Constructs a client from raw options; see {@link ClientResolver} for the recognized keys.
   *
   * @throws IllegalArgumentException if any required option is missing or invalid
   */
  public ServiceClient(final Map<String, ?> options) {
    this(new ClientResolver().resolve(options));
  }

  public ServiceClient(final ClientConfiguration configuration) {
    this.configuration = configuration;

    this.signer = configuration.signatureProvider().resolve(configuration.signatureVersion(),
        configuration.api().getSigningName(),
        configuration.region());

    this.pipeline = new RequestPipeline(configuration.serializer(),
        configuration.transport(),
        signer,
        configuration.credentials());

    this.translator = new ResponseTranslator(configuration.api().getServiceFullName(),
        configuration.resultParser(),
        configuration.errorParser(),
        configuration.exceptionFactory());

    logger.debug("Created client for {} in {} at {}", configuration.api().getServiceFullName(),
        configuration.region(), configuration.endpoint());
  }

  public ClientConfiguration getConfiguration() {
    return configuration;
  }

  public ServiceDescription getApi() {
    return configuration.api();
  }

  public CredentialsProvider getCredentials() {
    return configuration.credentials();
  }

  public URI getEndpoint() {
    return configuration.endpoint();
  }

  public String getRegion() {
    return configuration.region();
  }

  @VisibleForTesting
  Signer getSigner() {
    return signer;
  }

  /**
   * Builds a command for the named operation. The name is matched exactly, then with its first letter upper-cased.
   * Client default parameters are applied wherever {@code parameters} has no explicit value.
   *
   * @throws IllegalArgumentException if the service has no such operation
   */
  public Command getCommand(final String name, final Map<String, ?> parameters) {
    return Command.newBuilder(resolveOperationName(name))
        .withParameters(parameters)
        .withDefaults(configuration.defaults())
        .build();
  }

  /**
   * Executes an operation and blocks until it completes.
   *
   * @throws IllegalArgumentException if the service has no such operation; nothing is sent in that case
   * @throws ServiceClientException if the call fails for any other reason
   */
  public Result execute(final String name, final Map<String, ?> parameters) {
    return execute(getCommand(name, parameters));
  }

  public Result execute(final Command command) {
    return executeAsync(command).await();
  }

  /**
   * Starts executing an operation and returns immediately.
   *
   * @throws IllegalArgumentException if the service has no such operation; nothing is sent in that case
   */
  public FutureResult<Result> executeAsync(final String name, final Map<String, ?> parameters) {
    return executeAsync(getCommand(name, parameters));
  }

  public FutureResult<Result> executeAsync(final Command command) {
    if (!configuration.api().hasOperation(command.getName())) {
      throw new IllegalArgumentException("Operation not found: " + command.getName());
    }

    final List<RequestInterceptor> interceptors = new ArrayList<>(configuration.interceptors());
    interceptors.addAll(command.getInterceptors());

    final Transaction transaction = new Transaction(this, command, interceptors);
    final Timer.Sample sample = Timer.start();

    final CompletableFuture<ServiceResponse> transfer;

    try {
      transfer = pipeline.transfer(transaction);
    } catch (final RuntimeException e) {
      transaction.setException(e);

      final ServiceClientException exception = translator.createCommandException(transaction);
      recordOutcome(sample, command, exception);

      return FutureResult.failed(exception);
    }

    final CompletableFuture<Result> result = transfer
        .handle((response, throwable) -> resolve(transaction, response, throwable))
        .whenComplete((ignored, throwable) -> recordOutcome(sample, command, throwable));

    return new FutureResult<>(result, () -> transfer.cancel(true));
  }

  /**
   * Returns a lazy, single-use sequence of result pages for a paginated operation.
   *
   * @throws IllegalArgumentException if the service has no such operation
   * @throws UnsupportedOperationException if the operation is not paginated
   */
  public ResultPaginator getPaginator(final String name, final Map<String, ?> parameters) {
    return getPaginator(name, parameters, UnaryOperator.identity());
  }

  public ResultPaginator getPaginator(final String name,
      final Map<String, ?> parameters,
      final UnaryOperator<PaginatorConfig> customizer) {

    final String operation = resolveOperationName(name);
    final PaginatorConfig paginatorConfig = configuration.api().getPaginatorConfig(operation)
        .map(customizer)
        .orElseThrow(() -> new UnsupportedOperationException(String.format(
            "The %s operation of %s does not support pagination", operation, configuration.api().getServiceFullName())));

    return new ResultPaginator(this, operation, parameters, paginatorConfig);
  }

  /**
   * Iterates over the items of an operation's first result key, across every page if the operation is paginated.
   *
   * @throws UnsupportedOperationException if the operation declares no result key
   */
  public Iterator<Object> getIterator(final String name, final Map<String, ?> parameters) {
    final String operation = resolveOperationName(name);
    final PaginatorConfig paginatorConfig = configuration.api().getPaginatorConfig(operation)
        .filter(config -> !config.resultKeys().isEmpty())
        .orElseThrow(() -> new UnsupportedOperationException(String.format(
            "There are no resources to iterate for the %s operation of %s", operation,
            configuration.api().getServiceFullName())));

    final String resultKey = paginatorConfig.resultKeys().get(0);

    if (paginatorConfig.isPaginated()) {
      return new ResultPaginator(this, operation, parameters, paginatorConfig).search(resultKey);
    }

    final Object items = execute(operation, parameters).search(resultKey);

    if (items == null) {
      return Collections.emptyIterator();
    }

    return items instanceof List<?> list
        ? Collections.<Object>unmodifiableList(list).iterator()
        : List.of(items).iterator();
  }

  /**
   * Polls until the named waiter reaches a terminal state.
   *
   * @return the result that satisfied a success acceptor, or {@code null} if success was signalled by an error
   *
   * @throws org.whispersystems.serviceclient.waiter.WaiterException if a failure acceptor matched or the attempt
   * budget was exhausted
   * @throws ServiceClientException if a poll failed with an error no acceptor recognized
   * @throws UnsupportedOperationException if the service defines no such waiter
   */
  @Nullable
  public Result waitUntil(final String name, final Map<String, ?> parameters) {
    return waitUntilAsync(name, parameters).await();
  }

  @Nullable
  public Result waitUntil(final String name,
      final Map<String, ?> parameters,
      final UnaryOperator<WaiterConfig> customizer) {

    return waitUntilAsync(name, parameters, customizer).await();
  }

  /**
   * Starts polling the named waiter immediately and returns a handle to the eventual outcome.
   */
  public FutureResult<Result> waitUntilAsync(final String name, final Map<String, ?> parameters) {
    return waitUntilAsync(name, parameters, UnaryOperator.identity());
  }

  public FutureResult<Result> waitUntilAsync(final String name,
      final Map<String, ?> parameters,
      final UnaryOperator<WaiterConfig> customizer) {

    final WaiterConfig waiterConfig = configuration.api().getWaiterConfig(name)
        .map(customizer)
        .orElseThrow(() -> new UnsupportedOperationException(String.format(
            "No waiter named %s is defined for %s", name, configuration.api().getServiceFullName())));

    return new Waiter(this, name, parameters, waiterConfig, configuration.scheduler()).start();
  }

  private String resolveOperationName(final String name) {
    if (configuration.api().hasOperation(name)) {
      return name;
    }

    final String normalized = name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);

    if (!configuration.api().hasOperation(normalized)) {
      throw new IllegalArgumentException("Operation not found: " + normalized);
    }

    return normalized;
  }

  private Result resolve(final Transaction transaction,
      @Nullable final ServiceResponse response,
      @Nullable final Throwable throwable) {

    if (throwable == null) {
      try {
        transaction.setResponse(response);
        return translator.processResult(transaction);
      } catch (final RuntimeException e) {
        transaction.setException(e);
      }
    } else {
      final Throwable cause = ExceptionUtils.unwrap(throwable);

      if (cause instanceof CancellationException cancellationException) {
        throw cancellationException;
      }

      transaction.setException(cause);
    }

    throw ExceptionUtils.wrap(translator.createCommandException(transaction));
  }

  private void recordOutcome(final Timer.Sample sample, final Command command, @Nullable final Throwable throwable) {
    sample.stop(Metrics.timer(EXECUTE_TIMER_NAME,
        "service", configuration.api().getSigningName(),
        "operation", command.getName(),
        "outcome", throwable == null ? "success" : "error"));
  }
}
