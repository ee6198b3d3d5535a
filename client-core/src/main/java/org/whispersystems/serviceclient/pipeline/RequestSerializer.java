/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.pipeline;

import org.whispersystems.serviceclient.Transaction;
import org.whispersystems.serviceclient.transport.ServiceRequest;

/**
 * Converts a transaction's command into a transport-level request according to a service's wire protocol.
 */
@FunctionalInterface
public interface RequestSerializer {

  ServiceRequest serialize(Transaction transaction);
}
