/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.transport;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Moves serialized requests over the wire. Implementations own socket I/O, connection reuse and low-level retries.
 */
public interface Transport {

  /**
   * Sends a request asynchronously.
   *
   * @param request the serialized request
   * @param beforeSend a hook that must be invoked immediately before every transmission attempt, after which the
   * request must not be modified; this is where requests are signed
   *
   * @return a future that yields the response for successful exchanges, or fails with a {@link TransportException}
   * if the remote service could not be reached or answered with an error status. Cancelling the future aborts the
   * exchange on a best-effort basis.
   */
  CompletableFuture<ServiceResponse> sendAsync(ServiceRequest request, Consumer<ServiceRequest> beforeSend);
}
