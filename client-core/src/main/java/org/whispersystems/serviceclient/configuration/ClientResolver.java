/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.configuration;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.serviceclient.ExceptionFactory;
import org.whispersystems.serviceclient.RequestInterceptor;
import org.whispersystems.serviceclient.ServiceClientException;
import org.whispersystems.serviceclient.auth.Credentials;
import org.whispersystems.serviceclient.auth.CredentialsProvider;
import org.whispersystems.serviceclient.auth.DefaultSignatureProvider;
import org.whispersystems.serviceclient.auth.SignatureProvider;
import org.whispersystems.serviceclient.description.ServiceDescription;
import org.whispersystems.serviceclient.pipeline.ErrorParser;
import org.whispersystems.serviceclient.pipeline.RequestSerializer;
import org.whispersystems.serviceclient.pipeline.ResultParser;
import org.whispersystems.serviceclient.transport.Transport;

/**
 * Validates raw client options against a table of declared arguments and produces an immutable
 * {@link ClientConfiguration}. Resolution fails on the first missing or ill-typed option.
 * <p>
 * The transport may be given either as a {@link Transport} or as a {@link Supplier} of one; suppliers are only
 * invoked once every other option has been validated, so that a misconfigured client never opens connections.
 */
public class ClientResolver {

  public static final String API = "api";
  public static final String TRANSPORT = "transport";
  public static final String SERIALIZER = "serializer";
  public static final String RESULT_PARSER = "result_parser";
  public static final String ERROR_PARSER = "error_parser";
  public static final String CREDENTIALS = "credentials";
  public static final String REGION = "region";
  public static final String ENDPOINT = "endpoint";
  public static final String SIGNATURE_VERSION = "signature_version";
  public static final String SIGNATURE_PROVIDER = "signature_provider";
  public static final String DEFAULTS = "defaults";
  public static final String EXCEPTION_FACTORY = "exception_factory";
  public static final String INTERCEPTORS = "interceptors";
  public static final String SCHEDULER = "scheduler";

  private static final Logger logger = LoggerFactory.getLogger(ClientResolver.class);

  /**
   * A declared client option.
   *
   * @param name the option key
   * @param type the type the option's value must have after coercion
   * @param required whether resolution fails if the option is absent
   * @param defaultValue supplies a value for absent optional options; may be {@code null}
   */
  public record Argument(String name, Class<?> type, boolean required, @Nullable Supplier<?> defaultValue) {

    public Argument {
      Objects.requireNonNull(name);
      Objects.requireNonNull(type);
    }
  }

  private static final List<Argument> DEFAULT_ARGUMENTS = List.of(
      new Argument(API, ServiceDescription.class, true, null),
      new Argument(SERIALIZER, RequestSerializer.class, true, null),
      new Argument(RESULT_PARSER, ResultParser.class, true, null),
      new Argument(ERROR_PARSER, ErrorParser.class, true, null),
      new Argument(CREDENTIALS, CredentialsProvider.class, true, null),
      new Argument(REGION, String.class, true, null),
      new Argument(ENDPOINT, URI.class, true, null),
      new Argument(SIGNATURE_VERSION, String.class, false, () -> DefaultSignatureProvider.V4),
      new Argument(SIGNATURE_PROVIDER, SignatureProvider.class, false, DefaultSignatureProvider::new),
      new Argument(DEFAULTS, Map.class, false, Map::of),
      new Argument(EXCEPTION_FACTORY, ExceptionFactory.class, false, () -> ExceptionFactory.DEFAULT),
      new Argument(INTERCEPTORS, List.class, false, List::of),
      new Argument(SCHEDULER, ScheduledExecutorService.class, false, null),
      new Argument(TRANSPORT, Transport.class, true, null));

  private final List<Argument> arguments;

  public ClientResolver() {
    this(DEFAULT_ARGUMENTS);
  }

  public ClientResolver(final List<Argument> arguments) {
    this.arguments = List.copyOf(arguments);
  }

  public static List<Argument> getDefaultArguments() {
    return DEFAULT_ARGUMENTS;
  }

  /**
   * @throws IllegalArgumentException naming the first missing or invalid option
   */
  public ClientConfiguration resolve(final Map<String, ?> options) {
    final Map<String, Object> resolved = new HashMap<>();

    for (final Argument argument : arguments) {
      final Object value = coerce(argument, options.get(argument.name()));

      if (value == null) {
        if (argument.required()) {
          throw new IllegalArgumentException("Missing required client configuration option: " + argument.name());
        }

        if (argument.defaultValue() != null) {
          resolved.put(argument.name(), argument.defaultValue().get());
        }

        continue;
      }

      if (!argument.type().isInstance(value) && !(TRANSPORT.equals(argument.name()) && value instanceof Supplier<?>)) {
        throw new IllegalArgumentException(String.format("Invalid client configuration option \"%s\": expected %s but got %s",
            argument.name(), argument.type().getSimpleName(), value.getClass().getName()));
      }

      resolved.put(argument.name(), value);
    }

    options.keySet().stream()
        .filter(key -> arguments.stream().noneMatch(argument -> argument.name().equals(key)))
        .forEach(key -> logger.debug("Ignoring unrecognized client configuration option: {}", key));

    validateDefaults(resolved.get(DEFAULTS));
    validateInterceptors(resolved.get(INTERCEPTORS));

    if (resolved.get(SIGNATURE_PROVIDER) instanceof SignatureProvider signatureProvider
        && resolved.get(API) instanceof ServiceDescription api) {

      // Fails on unknown signature versions; providers memoize, so the client gets the same signer later
      signatureProvider.resolve((String) resolved.get(SIGNATURE_VERSION), api.getSigningName(),
          (String) resolved.get(REGION));
    }

    final Transport transport = instantiateTransport(resolved.get(TRANSPORT));

    @SuppressWarnings("unchecked") final ClientConfiguration configuration = new ClientConfiguration(
        (ServiceDescription) resolved.get(API),
        transport,
        (RequestSerializer) resolved.get(SERIALIZER),
        (ResultParser) resolved.get(RESULT_PARSER),
        (ErrorParser) resolved.get(ERROR_PARSER),
        (CredentialsProvider) resolved.get(CREDENTIALS),
        (String) resolved.get(REGION),
        (URI) resolved.get(ENDPOINT),
        (String) resolved.get(SIGNATURE_VERSION),
        (SignatureProvider) resolved.get(SIGNATURE_PROVIDER),
        (Map<String, Object>) resolved.get(DEFAULTS),
        (ExceptionFactory<? extends ServiceClientException>) resolved.get(EXCEPTION_FACTORY),
        (List<RequestInterceptor>) resolved.get(INTERCEPTORS),
        (ScheduledExecutorService) resolved.get(SCHEDULER));

    return configuration;
  }

  @Nullable
  private static Object coerce(final Argument argument, @Nullable Object value) {
    if (value == null) {
      return null;
    }

    if (argument.type() == URI.class && value instanceof String string) {
      try {
        value = URI.create(string);
      } catch (final IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid client configuration option \"" + argument.name() + "\": " + e.getMessage(), e);
      }
    }

    if (argument.type() == URI.class && value instanceof URI uri && (uri.getScheme() == null || uri.getHost() == null)) {
      throw new IllegalArgumentException("Invalid client configuration option \"" + argument.name()
          + "\": endpoints must be absolute URIs with a host");
    }

    if (argument.type() == CredentialsProvider.class && value instanceof Credentials credentials) {
      return CredentialsProvider.of(credentials);
    }

    if (argument.type() == String.class && value instanceof String string && string.isBlank()) {
      throw new IllegalArgumentException("Invalid client configuration option \"" + argument.name() + "\": must not be blank");
    }

    return value;
  }

  private static void validateDefaults(@Nullable final Object defaults) {
    if (defaults instanceof Map<?, ?> map) {
      for (final Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String)) {
          throw new IllegalArgumentException("Invalid client configuration option \"" + DEFAULTS
              + "\": parameter names must be strings");
        }
      }
    }
  }

  private static void validateInterceptors(@Nullable final Object interceptors) {
    if (interceptors instanceof List<?> list) {
      for (final Object interceptor : list) {
        if (!(interceptor instanceof RequestInterceptor)) {
          throw new IllegalArgumentException("Invalid client configuration option \"" + INTERCEPTORS
              + "\": expected RequestInterceptor but got " + (interceptor == null ? "null" : interceptor.getClass().getName()));
        }
      }
    }
  }

  private static Transport instantiateTransport(final Object transport) {
    if (transport instanceof Transport instance) {
      return instance;
    }

    final Object supplied = ((Supplier<?>) transport).get();

    if (!(supplied instanceof Transport instance)) {
      throw new IllegalArgumentException("Invalid client configuration option \"" + TRANSPORT
          + "\": supplier did not produce a Transport");
    }

    return instance;
  }
}
