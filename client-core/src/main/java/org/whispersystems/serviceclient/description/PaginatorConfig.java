/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.description;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Describes how an operation's results are split across pages.
 *
 * @param inputTokens parameter names that carry continuation tokens into the next call
 * @param outputTokens result paths from which continuation tokens are read, paired by position with
 * {@code inputTokens}
 * @param resultKeys result paths holding the paginated items
 * @param moreResults an optional result path to a flag that must be truthy for another page to exist
 * @param limitKey an optional parameter name that caps the page size
 */
public record PaginatorConfig(List<String> inputTokens,
                              List<String> outputTokens,
                              List<String> resultKeys,
                              @Nullable String moreResults,
                              @Nullable String limitKey) {

  public PaginatorConfig {
    inputTokens = inputTokens == null ? List.of() : List.copyOf(inputTokens);
    outputTokens = outputTokens == null ? List.of() : List.copyOf(outputTokens);
    resultKeys = resultKeys == null ? List.of() : List.copyOf(resultKeys);

    if (inputTokens.size() != outputTokens.size()) {
      throw new IllegalArgumentException("Paginators must declare the same number of input and output tokens");
    }
  }

  public boolean isPaginated() {
    return !inputTokens.isEmpty();
  }

  public PaginatorConfig withResultKeys(final List<String> resultKeys) {
    return new PaginatorConfig(inputTokens, outputTokens, resultKeys, moreResults, limitKey);
  }
}
