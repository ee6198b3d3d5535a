/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import javax.annotation.Nullable;

/**
 * Normalized error fields extracted from an error response.
 *
 * @param code a service-specific error code, e.g. {@code ResourceNotFoundException}
 * @param type {@code client} or {@code server}, depending on which side the service blames; {@code null} if the
 * response did not contain a recognizable error structure
 * @param message the service's description of the error
 * @param requestId the service-assigned identifier of the failed request, if any
 */
public record ServiceError(@Nullable String code,
                           @Nullable String type,
                           @Nullable String message,
                           @Nullable String requestId) {

  public boolean isStructured() {
    return type != null;
  }
}
