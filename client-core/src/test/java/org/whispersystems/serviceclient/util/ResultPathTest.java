/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ResultPathTest {

  private static final Map<String, Object> DATA = Map.of(
      "Table", Map.of("TableStatus", "ACTIVE", "ItemCount", 12),
      "Contents", List.of(Map.of("Key", "a"), Map.of("Key", "b"), Map.of("Key", "c")),
      "Reservations", List.of(
          Map.of("Instances", List.of(Map.of("State", "running"), Map.of("State", "stopped"))),
          Map.of("Instances", List.of(Map.of("State", "running")))),
      "NextMarker", "");

  @Test
  void fields() {
    assertEquals("ACTIVE", ResultPath.search(DATA, "Table.TableStatus"));
    assertEquals(12, ResultPath.search(DATA, "Table.ItemCount"));
    assertNull(ResultPath.search(DATA, "Table.Missing"));
    assertNull(ResultPath.search(DATA, "Table.TableStatus.Nested"));
  }

  @Test
  void indexes() {
    assertEquals("a", ResultPath.search(DATA, "Contents[0].Key"));
    assertEquals("c", ResultPath.search(DATA, "Contents[-1].Key"));
    assertNull(ResultPath.search(DATA, "Contents[3].Key"));
    assertNull(ResultPath.search(DATA, "Table[0]"));
  }

  @Test
  void projections() {
    assertEquals(List.of("a", "b", "c"), ResultPath.search(DATA, "Contents[].Key"));
    assertEquals(List.of("running", "stopped", "running"), ResultPath.search(DATA, "Reservations[].Instances[].State"));
  }

  @Test
  void alternatives() {
    assertEquals("c", ResultPath.search(DATA, "NextMarker || Contents[-1].Key"));
    assertEquals("ACTIVE", ResultPath.search(DATA, "Table.TableStatus || Contents[-1].Key"));
    assertNull(ResultPath.search(DATA, "NextMarker || Missing"));
  }

  @Test
  void nullRoot() {
    assertNull(ResultPath.search(null, "Table"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "Table..Status", "Contents[x]", "Contents[0", ".Table"})
  void invalidExpressions(final String expression) {
    assertThrows(IllegalArgumentException.class, () -> ResultPath.search(DATA, expression));
  }
}
