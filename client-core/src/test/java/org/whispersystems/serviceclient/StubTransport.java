/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import org.whispersystems.serviceclient.transport.ServiceRequest;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.transport.Transport;
import org.whispersystems.serviceclient.transport.TransportException;

/**
 * A scripted transport: replies are consumed in the order they were queued, one per request.
 */
public class StubTransport implements Transport {

  private final Queue<Function<ServiceRequest, CompletableFuture<ServiceResponse>>> replies =
      new ConcurrentLinkedQueue<>();

  private final List<ServiceRequest> requests = new CopyOnWriteArrayList<>();
  private final List<Map<String, List<String>>> sentHeaders = new CopyOnWriteArrayList<>();

  public StubTransport respond(final int status, final String body) {
    replies.add(request -> {
      final ServiceResponse response = new ServiceResponse(status,
          Map.of("x-request-id", List.of("request-" + (requests.size()))),
          body.getBytes(StandardCharsets.UTF_8));

      return status >= 400
          ? CompletableFuture.failedFuture(new TransportException("HTTP " + status, request, response))
          : CompletableFuture.completedFuture(response);
    });

    return this;
  }

  public StubTransport respond(final String body) {
    return respond(200, body);
  }

  public StubTransport fail(final Throwable cause) {
    replies.add(request -> CompletableFuture.failedFuture(
        new TransportException("connection failed: " + cause.getMessage(), request, null, cause)));

    return this;
  }

  /**
   * Queues a reply that never completes on its own.
   */
  public CompletableFuture<ServiceResponse> hang() {
    final CompletableFuture<ServiceResponse> reply = new CompletableFuture<>();
    replies.add(request -> reply);

    return reply;
  }

  @Override
  public CompletableFuture<ServiceResponse> sendAsync(final ServiceRequest request,
      final Consumer<ServiceRequest> beforeSend) {

    try {
      beforeSend.accept(request);
    } catch (final RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }

    requests.add(request);

    final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.putAll(request.getHeaders());
    sentHeaders.add(headers);

    final Function<ServiceRequest, CompletableFuture<ServiceResponse>> reply = replies.poll();

    return reply != null
        ? reply.apply(request)
        : CompletableFuture.failedFuture(new IllegalStateException("Unexpected request to " + request.getUri()));
  }

  public List<ServiceRequest> getRequests() {
    return requests;
  }

  /**
   * @return the headers of each request as they were when it was sent
   */
  public List<Map<String, List<String>>> getSentHeaders() {
    return sentHeaders;
  }
}
