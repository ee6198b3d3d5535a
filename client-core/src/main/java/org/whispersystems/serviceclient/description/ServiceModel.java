/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.description;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.util.SystemMapper;

/**
 * A service description loaded from a JSON document of the form:
 *
 * <pre>
 * {
 *   "metadata":   { "serviceFullName": "...", "signingName": "...", ... },
 *   "operations": { "GetItem": { ... }, ... },
 *   "paginators": { "ListTables": { "input_token": "...", "output_token": "...", "result_key": "..." } },
 *   "waiters":    { "TableExists": { "operation": "DescribeTable", "delay": 20, "maxAttempts": 25,
 *                                    "acceptors": [ ... ] } }
 * }
 * </pre>
 */
public class ServiceModel implements ServiceDescription {

  @JsonProperty
  private Map<String, String> metadata = Collections.emptyMap();

  @JsonProperty
  private Map<String, Map<String, Object>> operations = Collections.emptyMap();

  @JsonProperty
  private Map<String, PaginatorModel> paginators = Collections.emptyMap();

  @JsonProperty
  private Map<String, WaiterModel> waiters = Collections.emptyMap();

  public ServiceModel() {
  }

  public static ServiceModel fromJson(final InputStream inputStream) throws IOException {
    return SystemMapper.jsonMapper().readValue(inputStream, ServiceModel.class);
  }

  public static ServiceModel fromJson(final String json) throws IOException {
    return SystemMapper.jsonMapper().readValue(json, ServiceModel.class);
  }

  @Override
  public boolean hasOperation(final String name) {
    return operations.containsKey(name);
  }

  @Override
  public Optional<PaginatorConfig> getPaginatorConfig(final String operationName) {
    return Optional.ofNullable(paginators.get(operationName)).map(PaginatorModel::toPaginatorConfig);
  }

  @Override
  public Optional<WaiterConfig> getWaiterConfig(final String waiterName) {
    return Optional.ofNullable(waiters.get(waiterName)).map(WaiterModel::toWaiterConfig);
  }

  @Override
  public String getSigningName() {
    return getMetadata("signingName")
        .or(() -> getMetadata("endpointPrefix"))
        .orElseThrow(() -> new IllegalStateException("Service description declares no signing name"));
  }

  @Override
  public String getServiceFullName() {
    return getMetadata("serviceFullName").orElseGet(this::getSigningName);
  }

  @Override
  public Optional<String> getMetadata(final String key) {
    return Optional.ofNullable(metadata.get(key));
  }

  public Map<String, Object> getOperation(final String name) {
    return operations.getOrDefault(name, Collections.emptyMap());
  }

  static class PaginatorModel {

    public PaginatorModel() {
    }

    @JsonProperty("input_token")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> inputToken;

    @JsonProperty("output_token")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> outputToken;

    @JsonProperty("result_key")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> resultKey;

    @Nullable
    @JsonProperty("more_results")
    private String moreResults;

    @Nullable
    @JsonProperty("limit_key")
    private String limitKey;

    PaginatorConfig toPaginatorConfig() {
      return new PaginatorConfig(inputToken, outputToken, resultKey, moreResults, limitKey);
    }
  }

  static class WaiterModel {

    public WaiterModel() {
    }

    @Nullable
    @JsonProperty
    private String operation;

    @JsonProperty
    private int delay;

    @JsonProperty
    private int maxAttempts;

    @JsonProperty
    private List<Acceptor> acceptors;

    WaiterConfig toWaiterConfig() {
      return new WaiterConfig(operation, Duration.ofSeconds(delay), maxAttempts, acceptors);
    }
  }
}
