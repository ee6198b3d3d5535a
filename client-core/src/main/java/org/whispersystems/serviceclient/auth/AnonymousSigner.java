/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

import org.whispersystems.serviceclient.transport.ServiceRequest;

/**
 * Leaves requests unsigned, for operations that accept anonymous callers.
 */
public final class AnonymousSigner implements Signer {

  public static final AnonymousSigner INSTANCE = new AnonymousSigner();

  private AnonymousSigner() {
  }

  @Override
  public void signRequest(final ServiceRequest request, final Credentials credentials) {
  }
}
