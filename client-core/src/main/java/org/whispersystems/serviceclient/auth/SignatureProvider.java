/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

/**
 * Resolves a signing strategy for a signature scheme, service signing name and region.
 */
@FunctionalInterface
public interface SignatureProvider {

  /**
   * @throws IllegalArgumentException if the signature version is not supported
   */
  Signer resolve(String signatureVersion, String signingName, String region);
}
