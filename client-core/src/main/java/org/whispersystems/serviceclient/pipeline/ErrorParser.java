/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.pipeline;

import java.util.Optional;
import org.whispersystems.serviceclient.ServiceError;
import org.whispersystems.serviceclient.transport.ServiceResponse;

/**
 * Extracts normalized error fields from an error response.
 */
@FunctionalInterface
public interface ErrorParser {

  /**
   * @return the normalized error, or empty if the response carries no recognizable error structure
   */
  Optional<ServiceError> parse(ServiceResponse response);
}
