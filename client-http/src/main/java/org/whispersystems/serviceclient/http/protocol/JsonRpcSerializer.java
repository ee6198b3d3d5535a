/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import org.whispersystems.serviceclient.Command;
import org.whispersystems.serviceclient.Transaction;
import org.whispersystems.serviceclient.pipeline.RequestSerializer;
import org.whispersystems.serviceclient.transport.ServiceRequest;
import org.whispersystems.serviceclient.util.SystemMapper;

/**
 * Serializes commands for JSON-RPC style services: every operation is a {@code POST} of the command's parameters as
 * a JSON object, and the operation is named by the {@code X-Amz-Target} header.
 */
public class JsonRpcSerializer implements RequestSerializer {

  private final String targetPrefix;
  private final String contentType;

  private static final ObjectMapper MAPPER = SystemMapper.jsonMapper();

  /**
   * @param targetPrefix the prefix of the target header, e.g. {@code DynamoDB_20120810}
   * @param jsonVersion the protocol's JSON version, e.g. {@code 1.0}
   */
  public JsonRpcSerializer(final String targetPrefix, final String jsonVersion) {
    this.targetPrefix = targetPrefix;
    this.contentType = "application/x-amz-json-" + jsonVersion;
  }

  @Override
  public ServiceRequest serialize(final Transaction transaction) {
    final Command command = transaction.getCommand();
    final URI endpoint = transaction.getClient().getEndpoint();

    final byte[] body;

    try {
      body = MAPPER.writeValueAsBytes(command.getParameters());
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Parameters of " + command.getName() + " cannot be serialized", e);
    }

    final URI uri = endpoint.getRawPath() == null || endpoint.getRawPath().isEmpty()
        ? endpoint.resolve("/")
        : endpoint;

    return new ServiceRequest("POST", uri, body)
        .setHeader("Content-Type", contentType)
        .setHeader("X-Amz-Target", targetPrefix + "." + command.getName());
  }
}
