/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.transport;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A serialized, transport-level request. Request interceptors (including the signer) mutate headers in place
 * immediately before each transmission attempt, so instances are owned by exactly one transaction and are not
 * thread-safe.
 */
public class ServiceRequest {

  private final String method;
  private final URI uri;
  private final byte[] body;
  private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  public ServiceRequest(final String method, final URI uri) {
    this(method, uri, new byte[0]);
  }

  public ServiceRequest(final String method, final URI uri, final byte[] body) {
    this.method = Objects.requireNonNull(method).toUpperCase();
    this.uri = Objects.requireNonNull(uri);
    this.body = Objects.requireNonNull(body).clone();
  }

  public String getMethod() {
    return method;
  }

  public URI getUri() {
    return uri;
  }

  /**
   * @return a copy of the serialized body
   */
  public byte[] getBody() {
    return body.clone();
  }

  /**
   * Replaces any existing values of the given header.
   */
  public ServiceRequest setHeader(final String name, final String value) {
    final List<String> values = new ArrayList<>(1);
    values.add(value);
    headers.put(name, values);
    return this;
  }

  public ServiceRequest addHeader(final String name, final String value) {
    headers.computeIfAbsent(name, ignored -> new ArrayList<>(1)).add(value);
    return this;
  }

  public void removeHeader(final String name) {
    headers.remove(name);
  }

  public Optional<String> getHeader(final String name) {
    final List<String> values = headers.get(name);
    return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }

  public Map<String, List<String>> getHeaders() {
    return Collections.unmodifiableMap(headers);
  }

  @Override
  public String toString() {
    return method + " " + uri;
  }
}
