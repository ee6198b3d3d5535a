/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import javax.annotation.Nullable;

/**
 * Creates the exception type of a client family. Service integrations that declare their own subclass of
 * {@link ServiceClientException} pass a constructor reference at client construction, e.g.
 * {@code ExceptionFactory<DynamoDbException> factory = DynamoDbException::new}.
 */
@FunctionalInterface
public interface ExceptionFactory<E extends ServiceClientException> {

  ExceptionFactory<ServiceClientException> DEFAULT = ServiceClientException::new;

  E create(String message, Transaction transaction, @Nullable Throwable cause);
}
