/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.serviceclient.ServiceError;
import org.whispersystems.serviceclient.pipeline.ErrorParser;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.util.SystemMapper;

/**
 * Extracts errors from JSON error bodies of the form
 * {@code {"__type": "com.example.service#ResourceNotFoundException", "message": "..."}}. The error code is the part of
 * {@code __type} after the last {@code #}, falling back to the {@code x-amzn-ErrorType} header. Errors are classified
 * as {@code client} errors for 4xx responses and {@code server} errors otherwise.
 */
public class JsonErrorParser implements ErrorParser {

  private static final Logger logger = LoggerFactory.getLogger(JsonErrorParser.class);

  private static final ObjectMapper MAPPER = SystemMapper.jsonMapper();

  private static final String ERROR_TYPE_HEADER = "x-amzn-ErrorType";
  private static final String REQUEST_ID_HEADER = "x-amzn-RequestId";

  @Override
  public Optional<ServiceError> parse(final ServiceResponse response) {
    final JsonNode root;

    try {
      root = MAPPER.readTree(response.getBody());
    } catch (final IOException e) {
      logger.debug("Error response body is not JSON", e);
      return Optional.empty();
    }

    if (root == null || !root.isObject()) {
      return Optional.empty();
    }

    final String code = Optional.ofNullable(text(root, "__type"))
        .map(type -> type.substring(type.lastIndexOf('#') + 1))
        .or(() -> response.getHeader(ERROR_TYPE_HEADER).map(JsonErrorParser::stripHeaderSuffix))
        .orElse(null);

    final String message = Optional.ofNullable(text(root, "message"))
        .orElseGet(() -> text(root, "Message"));

    final String type = code == null ? null : response.getStatusCode() < 500 ? "client" : "server";

    return Optional.of(new ServiceError(code, type, message, response.getHeader(REQUEST_ID_HEADER).orElse(null)));
  }

  @Nullable
  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  private static String stripHeaderSuffix(final String errorType) {
    final int colon = errorType.indexOf(':');
    return colon >= 0 ? errorType.substring(0, colon) : errorType;
  }
}
