/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.description;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.whispersystems.serviceclient.TestServiceClients;

class ServiceModelTest {

  private final ServiceModel serviceModel = TestServiceClients.widgetService();

  @Test
  void metadata() {
    assertEquals("widgets", serviceModel.getSigningName());
    assertEquals("Widget Service", serviceModel.getServiceFullName());
    assertTrue(serviceModel.hasOperation("DescribeWidget"));
    assertFalse(serviceModel.hasOperation("describeWidget"));
  }

  @Test
  void signingNameFallsBackToEndpointPrefix() throws IOException {
    final ServiceModel model = ServiceModel.fromJson("""
        {"metadata": {"endpointPrefix": "gadgets"}, "operations": {"ListGadgets": {}}}
        """);

    assertEquals("gadgets", model.getSigningName());
    assertEquals("gadgets", model.getServiceFullName());
  }

  @Test
  void missingSigningName() throws IOException {
    final ServiceModel model = ServiceModel.fromJson("{\"operations\": {}}");

    assertThatThrownBy(model::getSigningName).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void paginators() {
    final PaginatorConfig listWidgets = serviceModel.getPaginatorConfig("ListWidgets").orElseThrow();

    assertEquals(List.of("NextToken"), listWidgets.inputTokens());
    assertEquals(List.of("NextToken"), listWidgets.outputTokens());
    assertEquals(List.of("Widgets"), listWidgets.resultKeys());
    assertEquals("MaxResults", listWidgets.limitKey());
    assertNull(listWidgets.moreResults());
    assertTrue(listWidgets.isPaginated());

    final PaginatorConfig listTags = serviceModel.getPaginatorConfig("ListTags").orElseThrow();
    assertEquals(List.of("NextMarker || Tags[-1].Key"), listTags.outputTokens());
    assertEquals("IsTruncated", listTags.moreResults());

    final PaginatorConfig describeGadgets = serviceModel.getPaginatorConfig("DescribeGadgets").orElseThrow();
    assertFalse(describeGadgets.isPaginated());
    assertEquals(List.of("Gadgets"), describeGadgets.resultKeys());

    assertTrue(serviceModel.getPaginatorConfig("DescribeWidget").isEmpty());
  }

  @Test
  void waiters() {
    final WaiterConfig widgetReady = serviceModel.getWaiterConfig("WidgetReady").orElseThrow();

    assertEquals("DescribeWidget", widgetReady.operation());
    assertEquals(Duration.ZERO, widgetReady.delay());
    assertEquals(3, widgetReady.maxAttempts());
    assertEquals(List.of(
            Acceptor.path(Acceptor.State.SUCCESS, "Widget.Status", "DONE"),
            Acceptor.path(Acceptor.State.FAILURE, "Widget.Status", "ERROR"),
            Acceptor.error(Acceptor.State.RETRY, "Throttled")),
        widgetReady.acceptors());

    final WaiterConfig widgetDeleted = serviceModel.getWaiterConfig("WidgetDeleted").orElseThrow();
    assertEquals(Acceptor.Matcher.PATH_ALL, widgetDeleted.acceptors().get(1).matcher());

    assertTrue(serviceModel.getWaiterConfig("WidgetExploded").isEmpty());
  }

  @Test
  void mismatchedPaginatorTokens() {
    assertThatThrownBy(() -> new PaginatorConfig(List.of("A", "B"), List.of("A"), List.of("Items"), null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void invalidWaiterConfig() {
    assertThatThrownBy(() -> new WaiterConfig("DescribeWidget", Duration.ofSeconds(-1), 3, List.of()))
        .isInstanceOf(IllegalArgumentException.class);

    assertThatThrownBy(() -> new WaiterConfig("DescribeWidget", Duration.ZERO, 0, List.of()))
        .isInstanceOf(IllegalArgumentException.class);

    assertThatThrownBy(() -> new Acceptor(Acceptor.State.SUCCESS, Acceptor.Matcher.PATH, null, "DONE"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
