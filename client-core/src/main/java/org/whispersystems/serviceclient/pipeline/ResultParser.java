/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.pipeline;

import org.whispersystems.serviceclient.Command;
import org.whispersystems.serviceclient.Result;
import org.whispersystems.serviceclient.transport.ServiceResponse;

/**
 * Converts a successful response into a result according to a service's wire protocol.
 */
@FunctionalInterface
public interface ResultParser {

  Result parse(Command command, ServiceResponse response);
}
