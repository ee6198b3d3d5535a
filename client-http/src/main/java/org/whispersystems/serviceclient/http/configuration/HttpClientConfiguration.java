/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * Settings for the HTTP transport.
 *
 * @param connectTimeout how long to wait for a connection to be established
 * @param requestTimeout how long to wait for each attempt's response
 * @param numClients the number of HTTP/2 clients requests are striped across
 * @param retry retry policy for transport failures and 5xx responses
 * @param circuitBreaker circuit breaker settings
 */
public record HttpClientConfiguration(@NotNull Duration connectTimeout,
                                      @NotNull Duration requestTimeout,
                                      @Min(1) int numClients,
                                      @Nullable @Valid RetryConfiguration retry,
                                      @Nullable @Valid CircuitBreakerConfiguration circuitBreaker) {

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

  public HttpClientConfiguration {
    if (connectTimeout == null) {
      connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    }

    if (requestTimeout == null) {
      requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    }

    if (numClients == 0) {
      numClients = 1;
    }

    if (retry == null) {
      retry = new RetryConfiguration();
    }

    if (circuitBreaker == null) {
      circuitBreaker = new CircuitBreakerConfiguration();
    }
  }

  public static HttpClientConfiguration defaults() {
    return new HttpClientConfiguration(null, null, 1, null, null);
  }
}
