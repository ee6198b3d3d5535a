/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.transport;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Indicates that an exchange with a remote service failed. If the remote service answered (for example with an error
 * status), the response is available via {@link #getResponse()}; connection-level failures carry no response.
 */
public class TransportException extends Exception {

  private final ServiceRequest request;

  @Nullable
  private final ServiceResponse response;

  public TransportException(final String message, final ServiceRequest request, @Nullable final ServiceResponse response) {
    this(message, request, response, null);
  }

  public TransportException(final String message,
      final ServiceRequest request,
      @Nullable final ServiceResponse response,
      @Nullable final Throwable cause) {

    super(message, cause);

    this.request = request;
    this.response = response;
  }

  public ServiceRequest getRequest() {
    return request;
  }

  public Optional<ServiceResponse> getResponse() {
    return Optional.ofNullable(response);
  }
}
