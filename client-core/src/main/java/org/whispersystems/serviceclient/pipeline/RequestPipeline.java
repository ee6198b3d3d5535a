/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.whispersystems.serviceclient.RequestInterceptor;
import org.whispersystems.serviceclient.Transaction;
import org.whispersystems.serviceclient.auth.CredentialsProvider;
import org.whispersystems.serviceclient.auth.Signer;
import org.whispersystems.serviceclient.transport.ServiceRequest;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.transport.Transport;

/**
 * Serializes a transaction's command, arranges for the request to be intercepted and signed immediately before
 * transmission, and hands it to the transport.
 */
public class RequestPipeline {

  private final RequestSerializer serializer;
  private final Transport transport;
  private final RequestInterceptor signingInterceptor;

  public RequestPipeline(final RequestSerializer serializer,
      final Transport transport,
      final Signer signer,
      final CredentialsProvider credentialsProvider) {

    this.serializer = serializer;
    this.transport = transport;

    // Credentials are read at send time so that refreshing providers are honored on every attempt
    this.signingInterceptor = (request, transaction) ->
        signer.signRequest(request, credentialsProvider.getCredentials());
  }

  /**
   * Serializes and sends the given transaction's request.
   *
   * @return the transport's own future, which yields the response or fails with whatever the transport reported;
   * cancelling it aborts the exchange
   *
   * @throws RuntimeException if the command could not be serialized; nothing is sent in that case
   */
  public CompletableFuture<ServiceResponse> transfer(final Transaction transaction) {
    final ServiceRequest request = serializer.serialize(transaction);

    if (request == null) {
      throw new IllegalStateException("Serializer produced no request for " + transaction.getCommand().getName());
    }

    transaction.setRequest(request);

    final List<RequestInterceptor> interceptors = new ArrayList<>(transaction.getInterceptors());
    interceptors.add(signingInterceptor);

    return transport.sendAsync(request,
        r -> interceptors.forEach(interceptor -> interceptor.beforeSend(r, transaction)));
  }
}
