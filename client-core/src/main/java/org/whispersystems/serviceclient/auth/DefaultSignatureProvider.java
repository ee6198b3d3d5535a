/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The built-in signature provider. Signers are memoized per (version, signing name, region), so clients of the same
 * service in the same region share one signer.
 */
public class DefaultSignatureProvider implements SignatureProvider {

  public static final String V4 = "v4";
  public static final String ANONYMOUS = "anonymous";

  private static final Logger logger = LoggerFactory.getLogger(DefaultSignatureProvider.class);

  private final Clock clock;
  private final Map<String, Signer> signers = new ConcurrentHashMap<>();

  public DefaultSignatureProvider() {
    this(Clock.systemUTC());
  }

  public DefaultSignatureProvider(final Clock clock) {
    this.clock = clock;
  }

  @Override
  public Signer resolve(final String signatureVersion, final String signingName, final String region) {
    return signers.computeIfAbsent(signatureVersion + "/" + signingName + "/" + region, ignored -> {
      logger.debug("Creating {} signer for {} in {}", signatureVersion, signingName, region);

      return switch (signatureVersion) {
        case V4 -> new SignatureV4Signer(signingName, region, clock);
        case ANONYMOUS -> AnonymousSigner.INSTANCE;
        default -> throw new IllegalArgumentException("Unknown signature version: " + signatureVersion);
      };
    });
  }
}
