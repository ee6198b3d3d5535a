/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.auth.DefaultSignatureProvider;

/**
 * Externalized settings for one service client, typically read from YAML:
 *
 * <pre>
 * region: us-east-1
 * endpoint: https://dynamodb.us-east-1.amazonaws.com
 * defaults:
 *   ConsistentRead: true
 * http:
 *   requestTimeout: PT5S
 *   retry:
 *     maxAttempts: 4
 * </pre>
 *
 * @param region the region requests are signed for
 * @param endpoint the base URI of the service
 * @param signatureVersion the signing scheme; {@code v4} if absent
 * @param defaults parameters applied to every command that does not set them explicitly
 * @param http transport settings
 */
public record ServiceClientConfiguration(@NotBlank String region,
                                         @NotNull URI endpoint,
                                         @Nullable String signatureVersion,
                                         @Nullable Map<String, Object> defaults,
                                         @Nullable @Valid HttpClientConfiguration http) {

  public ServiceClientConfiguration {
    if (signatureVersion == null) {
      signatureVersion = DefaultSignatureProvider.V4;
    }

    defaults = defaults == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));

    if (http == null) {
      http = HttpClientConfiguration.defaults();
    }
  }
}
