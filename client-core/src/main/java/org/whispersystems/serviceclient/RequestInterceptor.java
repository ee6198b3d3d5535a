/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient;

import org.whispersystems.serviceclient.transport.ServiceRequest;

/**
 * A hook that may modify a serialized request immediately before it is transmitted. Each transaction runs its own
 * ordered list of interceptors: the client's, then the command's, then the signer.
 */
@FunctionalInterface
public interface RequestInterceptor {

  void beforeSend(ServiceRequest request, Transaction transaction);
}
