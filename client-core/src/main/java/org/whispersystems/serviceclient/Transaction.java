/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.transport.ServiceRequest;
import org.whispersystems.serviceclient.transport.ServiceResponse;

/**
 * The record of a single operation invocation. A transaction is created when a command is executed and is updated in
 * place as the request is serialized, sent, and resolved to either a result or an exception. Transactions are never
 * shared between calls.
 */
public class Transaction {

  /**
   * Context key under which the normalized {@link ServiceError} of a failed call is stored.
   */
  public static final String SERVICE_ERROR = "service_error";

  private final ServiceClient client;
  private final Command command;
  private final List<RequestInterceptor> interceptors;
  private final Map<String, Object> context = new ConcurrentHashMap<>();

  @Nullable
  private volatile ServiceRequest request;

  @Nullable
  private volatile ServiceResponse response;

  @Nullable
  private volatile Result result;

  @Nullable
  private volatile Throwable exception;

  public Transaction(final ServiceClient client, final Command command, final List<RequestInterceptor> interceptors) {
    this.client = client;
    this.command = command;
    this.interceptors = List.copyOf(interceptors);
  }

  public ServiceClient getClient() {
    return client;
  }

  public Command getCommand() {
    return command;
  }

  public List<RequestInterceptor> getInterceptors() {
    return interceptors;
  }

  @Nullable
  public ServiceRequest getRequest() {
    return request;
  }

  public void setRequest(final ServiceRequest request) {
    this.request = request;
  }

  @Nullable
  public ServiceResponse getResponse() {
    return response;
  }

  public void setResponse(final ServiceResponse response) {
    this.response = response;
  }

  @Nullable
  public Result getResult() {
    return result;
  }

  public void setResult(final Result result) {
    this.result = result;
  }

  @Nullable
  public Throwable getException() {
    return exception;
  }

  public void setException(final Throwable exception) {
    this.exception = exception;
  }

  /**
   * @return free-form diagnostic data attached to this transaction
   */
  public Map<String, Object> getContext() {
    return context;
  }

  public Optional<ServiceError> getServiceError() {
    return context.get(SERVICE_ERROR) instanceof ServiceError serviceError
        ? Optional.of(serviceError)
        : Optional.empty();
  }
}
