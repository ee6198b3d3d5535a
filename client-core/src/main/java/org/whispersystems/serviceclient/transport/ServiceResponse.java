/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.transport;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An immutable, fully-buffered transport response.
 */
public class ServiceResponse {

  private final int statusCode;
  private final Map<String, List<String>> headers;
  private final byte[] body;

  public ServiceResponse(final int statusCode, final Map<String, List<String>> headers, final byte[] body) {
    final Map<String, List<String>> caseInsensitiveHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.forEach((name, values) -> caseInsensitiveHeaders.put(name, List.copyOf(values)));

    this.statusCode = statusCode;
    this.headers = Collections.unmodifiableMap(caseInsensitiveHeaders);
    this.body = body == null ? new byte[0] : body;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  public Optional<String> getHeader(final String name) {
    final List<String> values = headers.get(name);
    return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }

  public byte[] getBody() {
    return body;
  }

  public boolean hasBody() {
    return body.length > 0;
  }

  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "ServiceResponse{statusCode=" + statusCode + ", bodyLength=" + body.length + "}";
  }
}
