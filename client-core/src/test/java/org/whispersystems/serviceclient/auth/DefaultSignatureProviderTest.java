/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class DefaultSignatureProviderTest {

  private final DefaultSignatureProvider signatureProvider = new DefaultSignatureProvider();

  @Test
  void resolve() {
    assertThat(signatureProvider.resolve("v4", "widgets", "us-east-1")).isInstanceOf(SignatureV4Signer.class);
    assertSame(AnonymousSigner.INSTANCE, signatureProvider.resolve("anonymous", "widgets", "us-east-1"));
  }

  @Test
  void resolveMemoizes() {
    assertSame(signatureProvider.resolve("v4", "widgets", "us-east-1"),
        signatureProvider.resolve("v4", "widgets", "us-east-1"));

    assertNotSame(signatureProvider.resolve("v4", "widgets", "us-east-1"),
        signatureProvider.resolve("v4", "widgets", "eu-west-1"));
  }

  @Test
  void resolveUnknownVersion() {
    assertThatThrownBy(() -> signatureProvider.resolve("v3", "widgets", "us-east-1"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown signature version: v3");
  }
}
