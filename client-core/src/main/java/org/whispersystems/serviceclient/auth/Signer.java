/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

import org.whispersystems.serviceclient.transport.ServiceRequest;

/**
 * Computes and attaches authentication data to a fully-serialized request. Signers are shared by every request a
 * client sends and must be thread-safe.
 */
public interface Signer {

  void signRequest(ServiceRequest request, Credentials credentials);
}
