/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.description;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A rule evaluated against each waiter poll outcome.
 *
 * @param state the state the waiter enters if this rule matches
 * @param matcher how the outcome is compared to {@code expected}
 * @param argument the result path inspected by path matchers; ignored by other matchers
 * @param expected the expected value
 */
public record Acceptor(State state, Matcher matcher, @Nullable String argument, Object expected) {

  public enum State {
    @JsonProperty("success")
    SUCCESS,

    @JsonProperty("failure")
    FAILURE,

    @JsonProperty("retry")
    RETRY
  }

  public enum Matcher {
    /**
     * The value at {@code argument} equals {@code expected}.
     */
    @JsonProperty("path")
    PATH,

    /**
     * The value at {@code argument} is a non-empty list whose elements all equal {@code expected}.
     */
    @JsonProperty("pathAll")
    PATH_ALL,

    /**
     * The value at {@code argument} is a list with at least one element equal to {@code expected}.
     */
    @JsonProperty("pathAny")
    PATH_ANY,

    /**
     * The response status code equals {@code expected}.
     */
    @JsonProperty("status")
    STATUS,

    /**
     * The call failed with a normalized error code equal to {@code expected}.
     */
    @JsonProperty("error")
    ERROR
  }

  public Acceptor {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(matcher, "matcher");
    Objects.requireNonNull(expected, "expected");

    if ((matcher == Matcher.PATH || matcher == Matcher.PATH_ALL || matcher == Matcher.PATH_ANY) && argument == null) {
      throw new IllegalArgumentException(matcher + " acceptors require an argument");
    }
  }

  public static Acceptor path(final State state, final String argument, final Object expected) {
    return new Acceptor(state, Matcher.PATH, argument, expected);
  }

  public static Acceptor status(final State state, final int expected) {
    return new Acceptor(state, Matcher.STATUS, null, expected);
  }

  public static Acceptor error(final State state, final String errorCode) {
    return new Acceptor(state, Matcher.ERROR, null, errorCode);
  }
}
