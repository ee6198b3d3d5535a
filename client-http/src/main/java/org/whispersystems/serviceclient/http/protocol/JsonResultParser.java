/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import org.whispersystems.serviceclient.Command;
import org.whispersystems.serviceclient.Result;
import org.whispersystems.serviceclient.pipeline.ResultParser;
import org.whispersystems.serviceclient.transport.ServiceResponse;
import org.whispersystems.serviceclient.util.SystemMapper;

/**
 * Parses JSON object response bodies into results. An empty body yields an empty result.
 */
public class JsonResultParser implements ResultParser {

  private static final ObjectMapper MAPPER = SystemMapper.jsonMapper();

  @Override
  public Result parse(final Command command, final ServiceResponse response) {
    if (!response.hasBody()) {
      return new Result(Map.of(), response);
    }

    final Map<String, Object> data;

    try {
      data = MAPPER.readValue(response.getBody(), SystemMapper.MAP_TYPE);
    } catch (final IOException e) {
      throw new UncheckedIOException("Response to " + command.getName() + " is not a JSON object", e);
    }

    return new Result(data != null ? data : Map.of(), response);
  }
}
