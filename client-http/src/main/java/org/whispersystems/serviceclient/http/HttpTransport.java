/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.whispersystems.serviceclient.transport.ServiceRequest;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.transport.Transport;
import org.whispersystems.serviceclient.transport.TransportException;
import org.whispersystems.serviceclient.util.ExceptionUtils;

/**
 * A {@link Transport} backed by a {@link FaultTolerantHttpClient}. Responses with a status of 400 or more fail with a
 * {@link TransportException} carrying the response; connection failures fail with a {@code TransportException}
 * carrying none.
 */
public class HttpTransport implements Transport {

  // Managed by java.net.http itself; HttpRequest.Builder rejects them
  private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

  private final FaultTolerantHttpClient httpClient;

  public HttpTransport(final FaultTolerantHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public CompletableFuture<ServiceResponse> sendAsync(final ServiceRequest request,
      final Consumer<ServiceRequest> beforeSend) {

    final CompletableFuture<HttpResponse<byte[]>> exchange = httpClient.sendAsync(() -> {
      beforeSend.accept(request);
      return toHttpRequest(request);
    }, HttpResponse.BodyHandlers.ofByteArray());

    final CompletableFuture<ServiceResponse> response = exchange.handle((httpResponse, throwable) -> {
      if (throwable != null) {
        final Throwable cause = ExceptionUtils.unwrap(throwable);

        if (cause instanceof CancellationException cancellationException) {
          throw cancellationException;
        }

        throw ExceptionUtils.wrap(new TransportException(
            String.format("%s %s failed: %s", request.getMethod(), request.getUri(), cause),
            request, null, cause));
      }

      final ServiceResponse serviceResponse = toServiceResponse(httpResponse);

      if (serviceResponse.getStatusCode() >= 400) {
        throw ExceptionUtils.wrap(new TransportException(
            String.format("%s %s returned HTTP %d", request.getMethod(), request.getUri(),
                serviceResponse.getStatusCode()),
            request, serviceResponse));
      }

      return serviceResponse;
    });

    response.whenComplete((ignored, throwable) -> {
      if (response.isCancelled()) {
        exchange.cancel(true);
      }
    });

    return response;
  }

  static HttpRequest toHttpRequest(final ServiceRequest request) {
    final HttpRequest.BodyPublisher bodyPublisher = request.getBody().length == 0
        ? HttpRequest.BodyPublishers.noBody()
        : HttpRequest.BodyPublishers.ofByteArray(request.getBody());

    final HttpRequest.Builder builder = HttpRequest.newBuilder(request.getUri())
        .method(request.getMethod(), bodyPublisher);

    for (final Map.Entry<String, List<String>> header : request.getHeaders().entrySet()) {
      if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase())) {
        continue;
      }

      header.getValue().forEach(value -> builder.header(header.getKey(), value));
    }

    return builder.build();
  }

  private static ServiceResponse toServiceResponse(final HttpResponse<byte[]> httpResponse) {
    return new ServiceResponse(httpResponse.statusCode(),
        httpResponse.headers().map(),
        httpResponse.body() != null ? httpResponse.body() : new byte[0]);
  }
}
