/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.configuration;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.whispersystems.serviceclient.util.SystemMapper;

class ServiceClientConfigurationTest {

  private static Validator validator;

  @BeforeAll
  static void setUpBeforeAll() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  private static ServiceClientConfiguration parse(final String yaml) throws IOException {
    return SystemMapper.yamlMapper().readValue(yaml, ServiceClientConfiguration.class);
  }

  private static Set<String> violatedPaths(final Object configuration) {
    return validator.validate(configuration).stream()
        .map(ConstraintViolation::getPropertyPath)
        .map(Object::toString)
        .collect(Collectors.toSet());
  }

  @Test
  void parseMinimal() throws IOException {
    final ServiceClientConfiguration configuration = parse("""
        region: us-east-1
        endpoint: https://dynamodb.us-east-1.amazonaws.com
        """);

    assertThat(configuration.region()).isEqualTo("us-east-1");
    assertThat(configuration.endpoint()).isEqualTo(URI.create("https://dynamodb.us-east-1.amazonaws.com"));
    assertThat(configuration.signatureVersion()).isEqualTo("v4");
    assertThat(configuration.defaults()).isEmpty();

    assertThat(configuration.http().connectTimeout()).isEqualTo(HttpClientConfiguration.DEFAULT_CONNECT_TIMEOUT);
    assertThat(configuration.http().requestTimeout()).isEqualTo(HttpClientConfiguration.DEFAULT_REQUEST_TIMEOUT);
    assertThat(configuration.http().numClients()).isEqualTo(1);
    assertThat(configuration.http().retry().getMaxAttempts()).isEqualTo(3);
    assertThat(configuration.http().circuitBreaker().getFailureRateThreshold()).isEqualTo(50);

    assertThat(violatedPaths(configuration)).isEmpty();
  }

  @Test
  void parseFull() throws IOException {
    final ServiceClientConfiguration configuration = parse("""
        region: eu-west-1
        endpoint: http://localhost:8000
        signatureVersion: anonymous
        defaults:
          ConsistentRead: true
          Limit: 25
        http:
          connectTimeout: PT2S
          requestTimeout: PT5S
          numClients: 4
          retry:
            maxAttempts: 5
            waitDuration: 50
            backoffMultiplier: 2.0
          circuitBreaker:
            failureRateThreshold: 25
            slidingWindowSize: 20
            slidingWindowMinimumNumberOfCalls: 10
            waitDurationInOpenState: PT30S
            ignoredExceptions:
              - java.util.concurrent.CancellationException
        """);

    assertThat(configuration.signatureVersion()).isEqualTo("anonymous");
    assertThat(configuration.defaults()).containsExactly(Map.entry("ConsistentRead", true), Map.entry("Limit", 25));

    final HttpClientConfiguration http = configuration.http();
    assertThat(http.connectTimeout()).isEqualTo(Duration.ofSeconds(2));
    assertThat(http.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(http.numClients()).isEqualTo(4);

    assertThat(http.retry().getMaxAttempts()).isEqualTo(5);
    assertThat(http.retry().getWaitDuration()).isEqualTo(50);
    assertThat(http.retry().getBackoffMultiplier()).isEqualTo(2.0);
    assertThat(http.retry().toRetryConfigBuilder().build().getMaxAttempts()).isEqualTo(5);

    assertThat(http.circuitBreaker().getFailureRateThreshold()).isEqualTo(25);
    assertThat(http.circuitBreaker().getWaitDurationInOpenState()).isEqualTo(Duration.ofSeconds(30));
    assertThat(http.circuitBreaker().getIgnoredExceptions())
        .containsExactly(CancellationException.class);
    assertThat(http.circuitBreaker().toCircuitBreakerConfig().getSlidingWindowSize()).isEqualTo(20);

    assertThat(violatedPaths(configuration)).isEmpty();
  }

  @Test
  void validateMissingFields() throws IOException {
    final ServiceClientConfiguration configuration = parse("""
        region: ""
        """);

    assertThat(violatedPaths(configuration)).containsExactlyInAnyOrder("region", "endpoint");
  }

  @Test
  void validateNestedFields() throws IOException {
    final ServiceClientConfiguration configuration = parse("""
        region: us-east-1
        endpoint: https://dynamodb.us-east-1.amazonaws.com
        http:
          numClients: -1
          retry:
            maxAttempts: 0
            backoffMultiplier: 0.5
          circuitBreaker:
            failureRateThreshold: 101
        """);

    assertThat(violatedPaths(configuration)).containsExactlyInAnyOrder(
        "http.numClients",
        "http.retry.maxAttempts",
        "http.retry.backoffMultiplier",
        "http.circuitBreaker.failureRateThreshold");
  }
}
