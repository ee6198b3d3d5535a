/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable request to invoke one operation with a set of parameters. Commands are built by
 * {@link ServiceClient#getCommand(String, Map)}, which validates the operation name and merges client defaults.
 */
public final class Command {

  private final String name;
  private final Map<String, Object> parameters;
  private final List<RequestInterceptor> interceptors;

  private Command(final String name, final Map<String, Object> parameters,
      final List<RequestInterceptor> interceptors) {

    this.name = name;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.interceptors = List.copyOf(interceptors);
  }

  public static Builder newBuilder(final String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  public Object getParameter(final String key) {
    return parameters.get(key);
  }

  public boolean hasParameter(final String key) {
    return parameters.containsKey(key);
  }

  /**
   * @return request interceptors that apply to this command only; they run after the client's interceptors and
   * before the request is signed
   */
  public List<RequestInterceptor> getInterceptors() {
    return interceptors;
  }

  /**
   * Returns a copy of this command with the given parameters layered over the existing ones.
   */
  public Command withParameters(final Map<String, ?> overrides) {
    final Map<String, Object> merged = new LinkedHashMap<>(parameters);
    merged.putAll(overrides);

    return new Command(name, merged, interceptors);
  }

  @Override
  public String toString() {
    return "Command{name=" + name + ", parameters=" + parameters.keySet() + "}";
  }

  public static class Builder {

    private final String name;
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final List<RequestInterceptor> interceptors = new ArrayList<>();

    private Builder(final String name) {
      this.name = Objects.requireNonNull(name);
    }

    public Builder withParameter(final String key, final Object value) {
      this.parameters.put(key, value);
      return this;
    }

    public Builder withParameters(final Map<String, ?> parameters) {
      this.parameters.putAll(parameters);
      return this;
    }

    /**
     * Adds parameters that are only applied where no explicit value was given.
     */
    public Builder withDefaults(final Map<String, ?> defaults) {
      defaults.forEach(this.parameters::putIfAbsent);
      return this;
    }

    public Builder withInterceptor(final RequestInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor));
      return this;
    }

    public Command build() {
      return new Command(name, parameters, interceptors);
    }
  }
}
