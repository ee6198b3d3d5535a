/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

/**
 * A source of credentials. Implementations may refresh credentials between calls; the signer asks for a fresh
 * snapshot immediately before each request is sent.
 */
@FunctionalInterface
public interface CredentialsProvider {

  Credentials getCredentials();

  static CredentialsProvider of(final Credentials credentials) {
    return () -> credentials;
  }
}
