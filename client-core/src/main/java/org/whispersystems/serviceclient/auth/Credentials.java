/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A snapshot of access credentials.
 *
 * @param accessKeyId the public half of the access key
 * @param secretAccessKey the secret used to derive signing keys
 * @param sessionToken an optional session token for temporary credentials
 */
public record Credentials(String accessKeyId, String secretAccessKey, @Nullable String sessionToken) {

  public Credentials {
    Objects.requireNonNull(accessKeyId, "accessKeyId");
    Objects.requireNonNull(secretAccessKey, "secretAccessKey");
  }

  public Credentials(final String accessKeyId, final String secretAccessKey) {
    this(accessKeyId, secretAccessKey, null);
  }

  @Override
  public String toString() {
    // never log secrets
    return "Credentials{accessKeyId=" + accessKeyId + "}";
  }
}
