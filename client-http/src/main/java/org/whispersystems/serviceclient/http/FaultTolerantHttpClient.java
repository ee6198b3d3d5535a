/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http;

import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.http.configuration.CircuitBreakerConfiguration;
import org.whispersystems.serviceclient.http.configuration.RetryConfiguration;
import org.whispersystems.serviceclient.http.util.ResilienceUtil;
import org.whispersystems.serviceclient.util.ExceptionUtils;

/**
 * An asynchronous HTTP client guarded by a circuit breaker and, optionally, a retry. Requests are built anew for each
 * attempt so that callers can refresh time-sensitive headers such as signatures before every retry.
 */
public class FaultTolerantHttpClient {

  private final List<HttpClient> httpClients;
  private final Duration defaultRequestTimeout;
  @Nullable private final ScheduledExecutorService retryExecutor;
  @Nullable private final Retry retry;
  private final CircuitBreaker breaker;

  public static Builder newBuilder(final String name, final Executor executor) {
    return new Builder(name, executor);
  }

  @VisibleForTesting
  FaultTolerantHttpClient(final List<HttpClient> httpClients,
      final Duration defaultRequestTimeout,
      @Nullable final ScheduledExecutorService retryExecutor,
      @Nullable final Retry retry,
      final CircuitBreaker circuitBreaker) {

    this.httpClients = httpClients;
    this.defaultRequestTimeout = defaultRequestTimeout;
    this.retryExecutor = retryExecutor;
    this.retry = retry;
    this.breaker = circuitBreaker;
  }

  private HttpClient httpClient() {
    return this.httpClients.get(ThreadLocalRandom.current().nextInt(this.httpClients.size()));
  }

  public <T> CompletableFuture<HttpResponse<T>> sendAsync(final HttpRequest request,
      final HttpResponse.BodyHandler<T> bodyHandler) {

    return sendAsync(() -> request, bodyHandler);
  }

  /**
   * Sends a request, building it from the given supplier before each attempt. If the supplier throws, the attempt
   * fails with the thrown exception. Cancelling the returned future cancels the attempt in flight and prevents
   * further retries.
   */
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(final Supplier<HttpRequest> requestSupplier,
      final HttpResponse.BodyHandler<T> bodyHandler) {

    final AtomicReference<CompletableFuture<HttpResponse<T>>> currentAttempt = new AtomicReference<>();
    final AtomicBoolean cancelled = new AtomicBoolean(false);

    final Supplier<CompletionStage<HttpResponse<T>>> asyncRequestSupplier = () -> {
      if (cancelled.get()) {
        return CompletableFuture.failedFuture(new CancellationException());
      }

      final CompletableFuture<HttpResponse<T>> attempt;

      try {
        attempt = httpClient().sendAsync(withDefaultTimeout(requestSupplier.get()), bodyHandler);
      } catch (final RuntimeException e) {
        return CompletableFuture.failedFuture(e);
      }

      currentAttempt.set(attempt);
      return attempt;
    };

    final CompletableFuture<HttpResponse<T>> response;

    if (retry != null) {
      assert retryExecutor != null;

      response = breaker.executeCompletionStage(Retry.decorateCompletionStage(retry, retryExecutor, asyncRequestSupplier))
          .toCompletableFuture();
    } else {
      response = breaker.executeCompletionStage(asyncRequestSupplier).toCompletableFuture();
    }

    response.whenComplete((ignored, throwable) -> {
      if (response.isCancelled()) {
        cancelled.set(true);

        final CompletableFuture<HttpResponse<T>> attempt = currentAttempt.get();

        if (attempt != null) {
          attempt.cancel(true);
        }
      }
    });

    return response;
  }

  private HttpRequest withDefaultTimeout(final HttpRequest request) {
    if (request.timeout().isPresent()) {
      return request;
    }

    return HttpRequest.newBuilder(request, (name, value) -> true)
        .timeout(defaultRequestTimeout)
        .build();
  }

  public static class Builder {

    private HttpClient.Version version = HttpClient.Version.HTTP_2;
    private HttpClient.Redirect redirect = HttpClient.Redirect.NEVER;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private int numClients = 1;

    private final String name;
    private final Executor executor;
    @Nullable private RetryConfiguration retryConfiguration;
    @Nullable private ScheduledExecutorService retryExecutor;
    @Nullable private Predicate<Throwable> retryOnException;
    @Nullable private CircuitBreakerConfiguration circuitBreakerConfiguration;

    private Builder(final String name, final Executor executor) {
      this.name = Objects.requireNonNull(name);
      this.executor = Objects.requireNonNull(executor);
    }

    public Builder withVersion(final HttpClient.Version version) {
      this.version = version;
      return this;
    }

    public Builder withRedirect(final HttpClient.Redirect redirect) {
      this.redirect = redirect;
      return this;
    }

    public Builder withConnectTimeout(final Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder withRequestTimeout(final Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder withRetry(@Nullable final RetryConfiguration retryConfiguration,
        final ScheduledExecutorService retryExecutor) {

      this.retryConfiguration = retryConfiguration;
      this.retryExecutor = retryExecutor;

      return this;
    }

    public Builder withCircuitBreaker(@Nullable final CircuitBreakerConfiguration circuitBreakerConfiguration) {
      this.circuitBreakerConfiguration = circuitBreakerConfiguration;
      return this;
    }

    public Builder withRetryOnException(final Predicate<Throwable> predicate) {
      this.retryOnException = throwable -> predicate.test(ExceptionUtils.unwrap(throwable));
      return this;
    }

    /**
     * Specify that the HttpClient should stripe requests across multiple HTTP clients
     * <p>
     * A {@link java.net.http.HttpClient} configured to use HTTP/2 will open a single connection per target host and
     * will send concurrent requests to that host over the same connection. To use a higher parallelism than the host
     * allows per connection, set a higher numClients; each request is assigned to a random client.
     * <p>
     * This builder will refuse to {@link #build()} if the HTTP version is not HTTP/2
     *
     * @param numClients The number of underlying HTTP clients to use
     * @return {@code this}
     */
    public Builder withNumClients(final int numClients) {
      this.numClients = numClients;
      return this;
    }

    public FaultTolerantHttpClient build() {
      if (numClients > 1 && version != HttpClient.Version.HTTP_2) {
        throw new IllegalArgumentException("Should not use additional HTTP clients unless using HTTP/2");
      }

      final List<HttpClient> httpClients = IntStream
          .range(0, numClients)
          .mapToObj(i -> HttpClient.newBuilder()
              .connectTimeout(connectTimeout)
              .followRedirects(redirect)
              .version(version)
              .executor(executor)
              .build())
          .toList();

      @Nullable final Retry retry;

      if (retryExecutor != null) {
        final RetryConfig.Builder<HttpResponse<?>> retryConfigBuilder = retryConfiguration != null
            ? retryConfiguration.toRetryConfigBuilder()
            : RetryConfig.from(ResilienceUtil.getRetryRegistry().getDefaultConfig());

        retryConfigBuilder.retryOnResult(response -> response.statusCode() >= 500);

        if (retryOnException != null) {
          retryConfigBuilder.retryOnException(retryOnException);
        }

        retry = ResilienceUtil.getRetryRegistry()
            .retry(ResilienceUtil.name(FaultTolerantHttpClient.class, name), retryConfigBuilder.build());
      } else {
        retry = null;
      }

      final String circuitBreakerName = ResilienceUtil.name(FaultTolerantHttpClient.class, name);

      final CircuitBreaker circuitBreaker = circuitBreakerConfiguration != null
          ? ResilienceUtil.getCircuitBreakerRegistry()
              .circuitBreaker(circuitBreakerName, circuitBreakerConfiguration.toCircuitBreakerConfig())
          : ResilienceUtil.getCircuitBreakerRegistry().circuitBreaker(circuitBreakerName);

      return new FaultTolerantHttpClient(httpClients, requestTimeout, retryExecutor, retry, circuitBreaker);
    }
  }
}
