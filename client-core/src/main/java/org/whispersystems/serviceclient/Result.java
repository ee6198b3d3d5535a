/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.util.ResultPath;

/**
 * The parsed output of an operation.
 */
public class Result {

  private final Map<String, Object> data;

  @Nullable
  private final ServiceResponse response;

  public Result(final Map<String, ?> data) {
    this(data, null);
  }

  /**
   * @param data the parsed output
   * @param response the response the output was parsed from, kept for its status code and headers
   */
  public Result(final Map<String, ?> data, @Nullable final ServiceResponse response) {
    this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    this.response = response;
  }

  @Nullable
  public Object get(final String key) {
    return data.get(key);
  }

  public boolean hasKey(final String key) {
    return data.containsKey(key);
  }

  /**
   * Evaluates a path expression such as {@code Table.TableStatus} or {@code Reservations[].Instances[]} against this
   * result.
   *
   * @return the value found, or {@code null} if the path does not resolve
   */
  @Nullable
  public Object search(final String expression) {
    return ResultPath.search(data, expression);
  }

  public Map<String, Object> toMap() {
    return data;
  }

  public OptionalInt getStatusCode() {
    return response == null ? OptionalInt.empty() : OptionalInt.of(response.getStatusCode());
  }

  public Map<String, List<String>> getHeaders() {
    return response == null ? Collections.emptyMap() : response.getHeaders();
  }

  public Optional<String> getHeader(final String name) {
    return response == null ? Optional.empty() : response.getHeader(name);
  }

  @Override
  public String toString() {
    return "Result" + data;
  }
}
