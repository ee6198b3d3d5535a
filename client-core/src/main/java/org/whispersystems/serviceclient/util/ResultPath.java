/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Evaluates the small path language used by paginators, iterators and waiter acceptors against parsed result data.
 * <p>
 * Supported forms:
 * <ul>
 *   <li>{@code Table.TableStatus}: nested field access</li>
 *   <li>{@code Items[0]}, {@code Contents[-1].Key}: list indexing, negative indexes count from the end</li>
 *   <li>{@code Reservations[].Instances[].State}: flattening projections</li>
 *   <li>{@code NextMarker || Contents[-1].Key}: the first alternative with a non-empty value</li>
 * </ul>
 */
public final class ResultPath {

  private ResultPath() {
  }

  private sealed interface Step permits Field, Index, Flatten {
  }

  private record Field(String name) implements Step {
  }

  private record Index(int index) implements Step {
  }

  private record Flatten() implements Step {
  }

  @Nullable
  public static Object search(@Nullable final Object root, final String expression) {
    for (final String alternative : expression.split("\\|\\|")) {
      final Object value = evaluate(root, parse(alternative.trim()), 0);

      if (!isEmpty(value)) {
        return value;
      }
    }

    return null;
  }

  /**
   * @return whether the given value is absent for the purposes of token extraction: {@code null}, an empty string,
   * or an empty collection or map
   */
  public static boolean isEmpty(@Nullable final Object value) {
    if (value == null) {
      return true;
    }

    if (value instanceof CharSequence charSequence) {
      return charSequence.length() == 0;
    }

    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }

    return value instanceof Map<?, ?> map && map.isEmpty();
  }

  private static List<Step> parse(final String expression) {
    if (expression.isEmpty()) {
      throw new IllegalArgumentException("Empty path expression");
    }

    final List<Step> steps = new ArrayList<>();

    for (final String part : expression.split("\\.", -1)) {
      final int bracket = part.indexOf('[');
      final String name = bracket < 0 ? part : part.substring(0, bracket);

      if (name.isEmpty() && bracket != 0) {
        throw new IllegalArgumentException("Invalid path expression: " + expression);
      }

      if (!name.isEmpty()) {
        steps.add(new Field(name));
      }

      int position = bracket;
      while (position >= 0 && position < part.length()) {
        final int close = part.indexOf(']', position);

        if (part.charAt(position) != '[' || close < 0) {
          throw new IllegalArgumentException("Invalid path expression: " + expression);
        }

        final String inner = part.substring(position + 1, close).trim();

        if (inner.isEmpty()) {
          steps.add(new Flatten());
        } else {
          try {
            steps.add(new Index(Integer.parseInt(inner)));
          } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid index in path expression: " + expression, e);
          }
        }

        position = close + 1;
      }
    }

    return steps;
  }

  @Nullable
  private static Object evaluate(@Nullable Object current, final List<Step> steps, final int from) {
    for (int i = from; i < steps.size(); i++) {
      if (current == null) {
        return null;
      }

      final Step step = steps.get(i);

      if (step instanceof Field field) {
        current = current instanceof Map<?, ?> map ? map.get(field.name()) : null;
      } else if (step instanceof Index index) {
        if (!(current instanceof List<?> list)) {
          return null;
        }

        final int resolved = index.index() < 0 ? list.size() + index.index() : index.index();
        current = resolved >= 0 && resolved < list.size() ? list.get(resolved) : null;
      } else {
        if (!(current instanceof List<?> list)) {
          return null;
        }

        return project(list, steps, i + 1);
      }
    }

    return current;
  }

  private static List<Object> project(final List<?> list, final List<Step> steps, final int from) {
    final List<Object> elements = new ArrayList<>();
    for (final Object element : list) {
      if (element instanceof List<?> nested) {
        elements.addAll(nested);
      } else {
        elements.add(element);
      }
    }

    final boolean nestedProjection = steps.subList(from, steps.size()).stream().anyMatch(s -> s instanceof Flatten);
    final List<Object> projected = new ArrayList<>();

    for (final Object element : elements) {
      final Object value = evaluate(element, steps, from);

      if (value == null) {
        continue;
      }

      if (nestedProjection && value instanceof List<?> values) {
        projected.addAll(values);
      } else {
        projected.add(value);
      }
    }

    return projected;
  }
}
