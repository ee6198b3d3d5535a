/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;

/**
 * Retry policy for transport-level failures. Requests are retried on I/O errors and on 5xx responses; each attempt is
 * re-signed before it is sent.
 */
public class RetryConfiguration {

  @JsonProperty
  @Min(1)
  private int maxAttempts = 3;

  /**
   * Milliseconds before the first retry.
   */
  @JsonProperty
  @Min(1)
  private long waitDuration = RetryConfig.DEFAULT_WAIT_DURATION;

  /**
   * Growth factor applied to the wait between successive retries; 1 means a fixed wait.
   */
  @JsonProperty
  @DecimalMin("1.0")
  private double backoffMultiplier = 1.0;

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(final int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public long getWaitDuration() {
    return waitDuration;
  }

  public void setWaitDuration(final long waitDuration) {
    this.waitDuration = waitDuration;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public void setBackoffMultiplier(final double backoffMultiplier) {
    this.backoffMultiplier = backoffMultiplier;
  }

  public <T> RetryConfig.Builder<T> toRetryConfigBuilder() {
    final RetryConfig.Builder<T> builder = RetryConfig.<T>custom()
        .maxAttempts(getMaxAttempts());

    if (getBackoffMultiplier() > 1.0) {
      builder.intervalFunction(
          IntervalFunction.ofExponentialBackoff(Duration.ofMillis(getWaitDuration()), getBackoffMultiplier()));
    } else {
      builder.waitDuration(Duration.ofMillis(getWaitDuration()));
    }

    return builder;
  }
}
