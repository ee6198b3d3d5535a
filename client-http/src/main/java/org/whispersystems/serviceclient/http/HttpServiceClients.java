/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.ExceptionFactory;
import org.whispersystems.serviceclient.RequestInterceptor;
import org.whispersystems.serviceclient.ServiceClient;
import org.whispersystems.serviceclient.ServiceClientException;
import org.whispersystems.serviceclient.auth.Credentials;
import org.whispersystems.serviceclient.auth.CredentialsProvider;
import org.whispersystems.serviceclient.configuration.ClientResolver;
import org.whispersystems.serviceclient.description.ServiceDescription;
import org.whispersystems.serviceclient.http.configuration.HttpClientConfiguration;
import org.whispersystems.serviceclient.http.configuration.ServiceClientConfiguration;
import org.whispersystems.serviceclient.http.protocol.JsonErrorParser;
import org.whispersystems.serviceclient.http.protocol.JsonResultParser;
import org.whispersystems.serviceclient.http.protocol.JsonRpcSerializer;
import org.whispersystems.serviceclient.pipeline.ErrorParser;
import org.whispersystems.serviceclient.pipeline.RequestSerializer;
import org.whispersystems.serviceclient.pipeline.ResultParser;
import org.whispersystems.serviceclient.transport.Transport;

/**
 * Builds {@link ServiceClient}s that talk to their service over HTTP.
 * <p>
 * The HTTP client is only created once every other option has been validated, so a misconfigured client fails
 * without opening any connections.
 */
public class HttpServiceClients {

  private static final ScheduledExecutorService DEFAULT_SCHEDULER = defaultScheduler();

  private HttpServiceClients() {
  }

  /**
   * @param name identifies the client's circuit breaker, retry and metrics; clients with the same name share them
   * @param api the description of the service
   */
  public static Builder newBuilder(final String name, final ServiceDescription api) {
    return new Builder(name, api);
  }

  private static ScheduledExecutorService defaultScheduler() {
    final ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
        .setNameFormat("service-client-scheduler-%d")
        .setDaemon(true)
        .build());

    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  public static class Builder {

    private final String name;
    private final ServiceDescription api;

    @Nullable private ServiceClientConfiguration configuration;
    @Nullable private CredentialsProvider credentials;
    @Nullable private RequestSerializer serializer;
    @Nullable private ResultParser resultParser;
    @Nullable private ErrorParser errorParser;
    @Nullable private ExceptionFactory<? extends ServiceClientException> exceptionFactory;
    private final List<RequestInterceptor> interceptors = new ArrayList<>();
    private Executor executor = ForkJoinPool.commonPool();
    private ScheduledExecutorService scheduler = DEFAULT_SCHEDULER;
    private HttpClient.Version version = HttpClient.Version.HTTP_2;

    private Builder(final String name, final ServiceDescription api) {
      this.name = Objects.requireNonNull(name);
      this.api = Objects.requireNonNull(api);
    }

    public Builder withConfiguration(final ServiceClientConfiguration configuration) {
      this.configuration = configuration;
      return this;
    }

    public Builder withCredentials(final Credentials credentials) {
      return withCredentials(CredentialsProvider.of(credentials));
    }

    public Builder withCredentials(final CredentialsProvider credentials) {
      this.credentials = credentials;
      return this;
    }

    /**
     * Uses the JSON-RPC protocol: requests are JSON objects posted to the endpoint root and routed by target header.
     */
    public Builder withJsonProtocol(final String targetPrefix, final String jsonVersion) {
      this.serializer = new JsonRpcSerializer(targetPrefix, jsonVersion);
      this.resultParser = new JsonResultParser();
      this.errorParser = new JsonErrorParser();
      return this;
    }

    public Builder withSerializer(final RequestSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    public Builder withResultParser(final ResultParser resultParser) {
      this.resultParser = resultParser;
      return this;
    }

    public Builder withErrorParser(final ErrorParser errorParser) {
      this.errorParser = errorParser;
      return this;
    }

    public Builder withExceptionFactory(final ExceptionFactory<? extends ServiceClientException> exceptionFactory) {
      this.exceptionFactory = exceptionFactory;
      return this;
    }

    public Builder withInterceptor(final RequestInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor));
      return this;
    }

    /**
     * Sets the executor on which HTTP responses are handled. Defaults to the common fork/join pool.
     */
    public Builder withExecutor(final Executor executor) {
      this.executor = Objects.requireNonNull(executor);
      return this;
    }

    /**
     * Sets the executor on which retries and waiter attempts are scheduled. Defaults to a shared daemon thread.
     */
    public Builder withScheduler(final ScheduledExecutorService scheduler) {
      this.scheduler = Objects.requireNonNull(scheduler);
      return this;
    }

    public Builder withVersion(final HttpClient.Version version) {
      this.version = Objects.requireNonNull(version);
      return this;
    }

    /**
     * @throws IllegalArgumentException if a required option is missing or invalid
     */
    public ServiceClient build() {
      if (configuration == null) {
        throw new IllegalArgumentException(
            "Missing required ServiceClientConfiguration; call withConfiguration before build");
      }

      final Map<String, Object> options = new HashMap<>();
      options.put(ClientResolver.API, api);
      options.put(ClientResolver.REGION, configuration.region());
      options.put(ClientResolver.ENDPOINT, configuration.endpoint());
      options.put(ClientResolver.SIGNATURE_VERSION, configuration.signatureVersion());
      options.put(ClientResolver.DEFAULTS, configuration.defaults());
      options.put(ClientResolver.INTERCEPTORS, List.copyOf(interceptors));
      options.put(ClientResolver.SCHEDULER, scheduler);

      putIfNotNull(options, ClientResolver.CREDENTIALS, credentials);
      putIfNotNull(options, ClientResolver.SERIALIZER, serializer);
      putIfNotNull(options, ClientResolver.RESULT_PARSER, resultParser);
      putIfNotNull(options, ClientResolver.ERROR_PARSER, errorParser);
      putIfNotNull(options, ClientResolver.EXCEPTION_FACTORY, exceptionFactory);

      final HttpClientConfiguration http = configuration.http();
      final Supplier<Transport> transport = () -> new HttpTransport(FaultTolerantHttpClient.newBuilder(name, executor)
          .withVersion(version)
          .withConnectTimeout(http.connectTimeout())
          .withRequestTimeout(http.requestTimeout())
          .withNumClients(http.numClients())
          .withRetry(http.retry(), scheduler)
          .withRetryOnException(throwable -> throwable instanceof IOException)
          .withCircuitBreaker(http.circuitBreaker())
          .build());

      options.put(ClientResolver.TRANSPORT, transport);

      return new ServiceClient(options);
    }

    private static void putIfNotNull(final Map<String, Object> options, final String key, @Nullable final Object value) {
      if (value != null) {
        options.put(key, value);
      }
    }
  }
}
