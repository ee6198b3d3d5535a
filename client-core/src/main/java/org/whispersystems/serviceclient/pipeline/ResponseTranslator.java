/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.pipeline;

import static com.google.common.base.Strings.nullToEmpty;

import java.net.URI;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.serviceclient.ExceptionFactory;
import org.whispersystems.serviceclient.Result;
import org.whispersystems.serviceclient.ServiceClientException;
import org.whispersystems.serviceclient.ServiceError;
import org.whispersystems.serviceclient.Transaction;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.transport.TransportException;
import org.whispersystems.serviceclient.util.ExceptionUtils;

/**
 * Resolves a transaction once the transport has finished with it: successful responses are parsed into results, and
 * every failure is normalized into exactly one exception of the client's family.
 */
public class ResponseTranslator {

  private static final Logger logger = LoggerFactory.getLogger(ResponseTranslator.class);

  private final String serviceName;
  private final ResultParser resultParser;
  private final ErrorParser errorParser;
  private final ExceptionFactory<? extends ServiceClientException> exceptionFactory;

  public ResponseTranslator(final String serviceName,
      final ResultParser resultParser,
      final ErrorParser errorParser,
      final ExceptionFactory<? extends ServiceClientException> exceptionFactory) {

    this.serviceName = serviceName;
    this.resultParser = resultParser;
    this.errorParser = errorParser;
    this.exceptionFactory = exceptionFactory;
  }

  /**
   * Populates the transaction's result from its response unless a result is already present.
   *
   * @throws IllegalStateException if no response was received
   */
  public Result processResult(final Transaction transaction) {
    if (transaction.getResult() != null) {
      return transaction.getResult();
    }

    final ServiceResponse response = transaction.getResponse();

    if (response == null) {
      throw new IllegalStateException("No response was received.");
    }

    final Result result = resultParser.parse(transaction.getCommand(), response);

    if (result == null) {
      throw new IllegalStateException("Result parser produced no result for " + transaction.getCommand().getName());
    }

    transaction.setResult(result);
    return result;
  }

  /**
   * Converts the transaction's exception into the client's exception type. Exceptions that already belong to a
   * client family are returned unchanged.
   */
  public ServiceClientException createCommandException(final Transaction transaction) {
    final Throwable exception = ExceptionUtils.unwrap(transaction.getException());

    if (exception instanceof ServiceClientException serviceClientException) {
      return serviceClientException;
    }

    if (!(exception instanceof TransportException transportException)) {
      return createUncaughtException(transaction, exception, null);
    }

    try {
      return createServiceException(transaction, transportException);
    } catch (final RuntimeException e) {
      return createUncaughtException(transaction, exception, e);
    }
  }

  private ServiceClientException createServiceException(final Transaction transaction,
      final TransportException transportException) {

    final URI url = transportException.getRequest().getUri();
    final Optional<ServiceResponse> maybeResponse = transportException.getResponse();

    String serviceError = transportException.getMessage();

    if (maybeResponse.isPresent()) {
      final ServiceResponse response = maybeResponse.get();
      transaction.setResponse(response);

      final Optional<ServiceError> maybeError = maybeResponse.filter(ServiceResponse::hasBody).flatMap(errorParser::parse);
      maybeError.ifPresent(error -> transaction.getContext().put(Transaction.SERVICE_ERROR, error));

      if (maybeError.isPresent() && maybeError.get().isStructured()) {
        final ServiceError error = maybeError.get();
        serviceError = (nullToEmpty(error.code()) + " (" + error.type() + " error): " + nullToEmpty(error.message()))
            .trim();
      }
    }

    logger.debug("{} failed on {}: {}", transaction.getCommand().getName(), url, serviceError);

    return exceptionFactory.create(String.format("Error executing %s::%s() on \"%s\"; %s",
            serviceName,
            lowerFirst(transaction.getCommand().getName()),
            url,
            serviceError),
        transaction,
        transportException);
  }

  /**
   * @param translationFailure an exception thrown while translating {@code exception}, if any; it is attached to the
   * result as a suppressed exception
   */
  private ServiceClientException createUncaughtException(final Transaction transaction,
      @Nullable final Throwable exception,
      @Nullable final RuntimeException translationFailure) {

    logger.warn("Uncaught exception while executing {}::{}", serviceName, transaction.getCommand().getName(),
        exception);

    final String message = String.format("Uncaught exception while executing %s::%s - %s",
        serviceName,
        transaction.getCommand().getName(),
        exception != null ? exception.getMessage() : "unknown error");

    ServiceClientException serviceClientException;

    try {
      serviceClientException = exceptionFactory.create(message, transaction, exception);
    } catch (final RuntimeException e) {
      logger.warn("Exception factory failed for {}::{}", serviceName, transaction.getCommand().getName(), e);

      serviceClientException = ExceptionFactory.DEFAULT.create(message, transaction, exception);

      serviceClientException.addSuppressed(e);
    }

    if (translationFailure != null) {
      serviceClientException.addSuppressed(translationFailure);
    }

    return serviceClientException;
  }

  private static String lowerFirst(final String name) {
    return name.isEmpty() ? name : Character.toLowerCase(name.charAt(0)) + name.substring(1);
  }
}
