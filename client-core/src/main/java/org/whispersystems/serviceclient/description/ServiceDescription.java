/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.description;

import java.util.Optional;

/**
 * Static, read-only metadata describing one remote service: which operations exist and how to paginate and wait on
 * them. A single description is shared by every transaction of a client.
 */
public interface ServiceDescription {

  boolean hasOperation(String name);

  Optional<PaginatorConfig> getPaginatorConfig(String operationName);

  Optional<WaiterConfig> getWaiterConfig(String waiterName);

  /**
   * @return the service name used when scoping request signatures
   */
  String getSigningName();

  /**
   * @return a human-readable name for the service, used in error messages
   */
  String getServiceFullName();

  /**
   * @return protocol-specific metadata such as a JSON target prefix
   */
  Optional<String> getMetadata(String key);
}
