/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

public class CircuitBreakerConfiguration {

  @JsonProperty
  @Min(1)
  @Max(100)
  private int failureRateThreshold = 50;

  @JsonProperty
  @Min(1)
  private int permittedNumberOfCallsInHalfOpenState = 10;

  @JsonProperty
  @Min(1)
  private int slidingWindowSize = 100;

  @JsonProperty
  @Min(1)
  private int slidingWindowMinimumNumberOfCalls = 100;

  @JsonProperty
  @NotNull
  private Duration waitDurationInOpenState = Duration.ofSeconds(10);

  /**
   * Fully-qualified names of exceptions that count as neither success nor failure.
   */
  @JsonProperty
  @NotNull
  private List<String> ignoredExceptions = Collections.emptyList();

  public int getFailureRateThreshold() {
    return failureRateThreshold;
  }

  public int getPermittedNumberOfCallsInHalfOpenState() {
    return permittedNumberOfCallsInHalfOpenState;
  }

  public int getSlidingWindowSize() {
    return slidingWindowSize;
  }

  public int getSlidingWindowMinimumNumberOfCalls() {
    return slidingWindowMinimumNumberOfCalls;
  }

  public Duration getWaitDurationInOpenState() {
    return waitDurationInOpenState;
  }

  public List<Class<?>> getIgnoredExceptions() {
    return ignoredExceptions.stream()
        .<Class<?>>map(name -> {
          try {
            return Class.forName(name);
          } catch (final ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown ignored exception class: " + name, e);
          }
        })
        .toList();
  }

  @VisibleForTesting
  public void setFailureRateThreshold(final int failureRateThreshold) {
    this.failureRateThreshold = failureRateThreshold;
  }

  @VisibleForTesting
  public void setSlidingWindowSize(final int size) {
    this.slidingWindowSize = size;
  }

  @VisibleForTesting
  public void setSlidingWindowMinimumNumberOfCalls(final int size) {
    this.slidingWindowMinimumNumberOfCalls = size;
  }

  @VisibleForTesting
  public void setPermittedNumberOfCallsInHalfOpenState(final int size) {
    this.permittedNumberOfCallsInHalfOpenState = size;
  }

  @VisibleForTesting
  public void setWaitDurationInOpenState(final Duration duration) {
    this.waitDurationInOpenState = duration;
  }

  @VisibleForTesting
  public void setIgnoredExceptions(final List<String> ignoredExceptions) {
    this.ignoredExceptions = ignoredExceptions;
  }

  @SuppressWarnings("unchecked")
  public CircuitBreakerConfig toCircuitBreakerConfig() {
    return CircuitBreakerConfig.custom()
        .failureRateThreshold(getFailureRateThreshold())
        .ignoreExceptions(getIgnoredExceptions().toArray(new Class[0]))
        .permittedNumberOfCallsInHalfOpenState(getPermittedNumberOfCallsInHalfOpenState())
        .waitDurationInOpenState(getWaitDurationInOpenState())
        .slidingWindow(getSlidingWindowSize(), getSlidingWindowMinimumNumberOfCalls(),
            CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .build();
  }
}
