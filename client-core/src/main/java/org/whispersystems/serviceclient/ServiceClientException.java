/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import java.net.URI;
import java.util.Optional;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.transport.TransportException;

/**
 * The single exception type surfaced by a client for any failed call. Services may declare a subclass and install it
 * with an {@link ExceptionFactory}; every failure, whether it came from the transport, the remote service or the
 * pipeline itself, is reported through that one type.
 */
public class ServiceClientException extends RuntimeException {

  private final transient Transaction transaction;

  public ServiceClientException(final String message, final Transaction transaction, @Nullable final Throwable cause) {
    super(message, cause);
    this.transaction = transaction;
  }

  /**
   * @return the transaction of the failed call, for introspection
   */
  public Transaction getTransaction() {
    return transaction;
  }

  public Command getCommand() {
    return transaction.getCommand();
  }

  public Optional<ServiceError> getServiceError() {
    return transaction.getServiceError();
  }

  @Nullable
  public String getErrorCode() {
    return getServiceError().map(ServiceError::code).orElse(null);
  }

  @Nullable
  public String getErrorType() {
    return getServiceError().map(ServiceError::type).orElse(null);
  }

  @Nullable
  public String getErrorMessage() {
    return getServiceError().map(ServiceError::message).orElse(null);
  }

  @Nullable
  public String getRequestId() {
    return getServiceError().map(ServiceError::requestId).orElse(null);
  }

  /**
   * @return the status code of the error response, or 0 if the remote service never answered
   */
  public int getStatusCode() {
    return getResponse().map(ServiceResponse::getStatusCode).orElse(0);
  }

  public Optional<ServiceResponse> getResponse() {
    if (transaction.getResponse() != null) {
      return Optional.of(transaction.getResponse());
    }

    return transaction.getException() instanceof TransportException transportException
        ? transportException.getResponse()
        : Optional.empty();
  }

  @Nullable
  public URI getUrl() {
    return transaction.getRequest() != null ? transaction.getRequest().getUri() : null;
  }
}
