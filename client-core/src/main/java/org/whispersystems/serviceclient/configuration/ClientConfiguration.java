/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.configuration;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.Nullable;
import org.whispersystems.serviceclient.ExceptionFactory;
import org.whispersystems.serviceclient.RequestInterceptor;
import org.whispersystems.serviceclient.ServiceClientException;
import org.whispersystems.serviceclient.auth.CredentialsProvider;
import org.whispersystems.serviceclient.auth.SignatureProvider;
import org.whispersystems.serviceclient.description.ServiceDescription;
import org.whispersystems.serviceclient.pipeline.ErrorParser;
import org.whispersystems.serviceclient.pipeline.RequestSerializer;
import org.whispersystems.serviceclient.pipeline.ResultParser;
import org.whispersystems.serviceclient.transport.Transport;

/**
 * The fully-resolved, immutable configuration of a client. Instances are produced by {@link ClientResolver}.
 *
 * @param scheduler the executor used to space out waiter attempts; if {@code null}, a shared JDK delayed executor is
 * used
 */
public record ClientConfiguration(ServiceDescription api,
                                  Transport transport,
                                  RequestSerializer serializer,
                                  ResultParser resultParser,
                                  ErrorParser errorParser,
                                  CredentialsProvider credentials,
                                  String region,
                                  URI endpoint,
                                  String signatureVersion,
                                  SignatureProvider signatureProvider,
                                  Map<String, Object> defaults,
                                  ExceptionFactory<? extends ServiceClientException> exceptionFactory,
                                  List<RequestInterceptor> interceptors,
                                  @Nullable ScheduledExecutorService scheduler) {

  public ClientConfiguration {
    defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    interceptors = List.copyOf(interceptors);
  }
}
