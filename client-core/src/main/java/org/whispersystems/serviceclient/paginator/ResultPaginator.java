/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.paginator;

import com.google.common.collect.Iterators;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.serviceclient.Command;
import org.whispersystems.serviceclient.Result;
import org.whispersystems.serviceclient.ServiceClient;
import org.whispersystems.serviceclient.description.PaginatorConfig;
import org.whispersystems.serviceclient.util.ResultPath;

/**
 * A lazy sequence of result pages. The first page is fetched when the sequence is first advanced; each subsequent
 * page is requested with the continuation tokens of the page before it, and the sequence ends when a page carries no
 * continuation token, when the page's "more results" flag is false, or when the service repeats the token it was just
 * given.
 * <p>
 * A paginator may be iterated only once. A failed page request propagates out of the iterator and ends the sequence.
 */
public class ResultPaginator implements Iterable<Result> {

  private static final Logger logger = LoggerFactory.getLogger(ResultPaginator.class);

  private final ServiceClient client;
  private final Command command;
  private final PaginatorConfig config;

  private final AtomicBoolean started = new AtomicBoolean(false);

  /**
   * @throws IllegalArgumentException if the service has no such operation
   * @throws UnsupportedOperationException if the paginator configuration names no result key
   */
  public ResultPaginator(final ServiceClient client,
      final String operation,
      final Map<String, ?> parameters,
      final PaginatorConfig config) {

    if (config.resultKeys().isEmpty()) {
      throw new UnsupportedOperationException(String.format("There are no resources to iterate for the %s operation of %s",
          operation, client.getApi().getServiceFullName()));
    }

    this.client = client;
    this.command = client.getCommand(operation, parameters);
    this.config = config;
  }

  public PaginatorConfig getConfig() {
    return config;
  }

  /**
   * @throws IllegalStateException if this paginator has already been iterated
   */
  @Override
  public Iterator<Result> iterator() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Paginator for " + command.getName() + " has already been iterated");
    }

    return new PageIterator();
  }

  public Stream<Result> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  /**
   * Evaluates a path expression against every page and iterates over the combined values. List values are
   * flattened; pages where the expression does not resolve contribute nothing.
   */
  public Iterator<Object> search(final String expression) {
    return Iterators.concat(Iterators.transform(iterator(), page -> toIterator(page.search(expression))));
  }

  private static Iterator<Object> toIterator(@Nullable final Object value) {
    if (value == null) {
      return Collections.emptyIterator();
    }

    if (value instanceof List<?> list) {
      return Collections.<Object>unmodifiableList(list).iterator();
    }

    return Iterators.singletonIterator(value);
  }

  private Map<String, Object> extractNextToken(final Result result) {
    final Map<String, Object> token = new LinkedHashMap<>();

    for (int i = 0; i < config.outputTokens().size(); i++) {
      final Object value = result.search(config.outputTokens().get(i));

      if (!ResultPath.isEmpty(value)) {
        token.put(config.inputTokens().get(i), value);
      }
    }

    return token;
  }

  private boolean hasMoreResults(final Result result) {
    if (config.moreResults() == null) {
      return true;
    }

    final Object moreResults = result.search(config.moreResults());
    return Boolean.TRUE.equals(moreResults) || "true".equalsIgnoreCase(String.valueOf(moreResults));
  }

  private class PageIterator implements Iterator<Result> {

    private Map<String, Object> nextToken = Map.of();

    @Nullable
    private Result next;

    private boolean exhausted = false;
    private int requestCount = 0;

    @Override
    public boolean hasNext() {
      if (next != null) {
        return true;
      }

      if (exhausted) {
        return false;
      }

      fetch();
      return true;
    }

    @Override
    public Result next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }

      final Result result = next;
      next = null;

      return result;
    }

    private void fetch() {
      final Result result;

      try {
        result = client.execute(command.withParameters(nextToken));
      } catch (final RuntimeException e) {
        exhausted = true;
        throw e;
      }

      requestCount++;

      final Map<String, Object> token = extractNextToken(result);

      if (token.isEmpty() || !hasMoreResults(result)) {
        exhausted = true;
      } else if (token.equals(nextToken)) {
        logger.debug("{} returned the same continuation token twice; ending pagination after {} requests",
            command.getName(), requestCount);

        exhausted = true;
      }

      nextToken = token;
      next = result;
    }
  }
}
