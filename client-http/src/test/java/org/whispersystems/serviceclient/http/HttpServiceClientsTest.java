/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.whispersystems.serviceclient.Result;
import org.whispersystems.serviceclient.ServiceClient;
import org.whispersystems.serviceclient.ServiceClientException;
import org.whispersystems.serviceclient.Transaction;
import org.whispersystems.serviceclient.auth.Credentials;
import org.whispersystems.serviceclient.description.ServiceModel;
import org.whispersystems.serviceclient.http.configuration.HttpClientConfiguration;
import org.whispersystems.serviceclient.http.configuration.RetryConfiguration;
import org.whispersystems.serviceclient.http.configuration.ServiceClientConfiguration;

class HttpServiceClientsTest {

  @RegisterExtension
  private final WireMockExtension wireMock = WireMockExtension.newInstance()
      .options(wireMockConfig().dynamicPort())
      .build();

  private static final String CONTENT_TYPE = "application/x-amz-json-1.0";
  private static final Credentials CREDENTIALS = new Credentials("AKIDEXAMPLE", "wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY");

  private static ServiceModel dynamoDb;

  private ScheduledExecutorService scheduler;
  private ServiceClient client;

  static class DynamoDbException extends ServiceClientException {

    public DynamoDbException(final String message, final Transaction transaction, @Nullable final Throwable cause) {
      super(message, transaction, cause);
    }
  }

  @BeforeAll
  static void setUpBeforeAll() throws IOException {
    try (final InputStream inputStream = HttpServiceClientsTest.class.getResourceAsStream("/fixtures/dynamodb-service.json")) {
      dynamoDb = ServiceModel.fromJson(inputStream);
    }
  }

  @BeforeEach
  void setUp(final TestInfo testInfo) {
    scheduler = Executors.newSingleThreadScheduledExecutor();

    final RetryConfiguration retryConfiguration = new RetryConfiguration();
    retryConfiguration.setWaitDuration(1);

    final HttpClientConfiguration http = new HttpClientConfiguration(null, null, 1, retryConfiguration, null);

    client = HttpServiceClients.newBuilder(testInfo.getDisplayName(), dynamoDb)
        .withConfiguration(new ServiceClientConfiguration("us-east-1",
            URI.create("http://localhost:" + wireMock.getPort()),
            null,
            Map.of("ReturnConsumedCapacity", "NONE"),
            http))
        .withCredentials(CREDENTIALS)
        .withJsonProtocol("DynamoDB_20120810", "1.0")
        .withExceptionFactory(DynamoDbException::new)
        .withVersion(HttpClient.Version.HTTP_1_1)
        .withScheduler(scheduler)
        .build();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    scheduler.shutdown();
    scheduler.awaitTermination(1, TimeUnit.SECONDS);
  }

  @Test
  void execute() {
    wireMock.stubFor(post(urlEqualTo("/"))
        .withHeader("X-Amz-Target", equalTo("DynamoDB_20120810.GetItem"))
        .willReturn(aResponse()
            .withHeader("Content-Type", CONTENT_TYPE)
            .withHeader("x-amzn-RequestId", "REQ1")
            .withBody("{\"Item\":{\"id\":{\"S\":\"1\"},\"color\":{\"S\":\"blue\"}}}")));

    final Result result = client.execute("getItem", Map.of("TableName", "Widgets", "Key", Map.of("id", Map.of("S", "1"))));

    assertThat(result.search("Item.color.S")).isEqualTo("blue");
    assertThat(result.getStatusCode()).hasValue(200);
    assertThat(result.getHeader("x-amzn-RequestId")).hasValue("REQ1");

    wireMock.verify(1, postRequestedFor(urlEqualTo("/"))
        .withHeader("Content-Type", equalTo(CONTENT_TYPE))
        .withHeader("X-Amz-Target", equalTo("DynamoDB_20120810.GetItem"))
        .withHeader("X-Amz-Date", matching("\\d{8}T\\d{6}Z"))
        .withHeader("Authorization", matching(
            "AWS4-HMAC-SHA256 Credential=AKIDEXAMPLE/\\d{8}/us-east-1/dynamodb/aws4_request, "
                + "SignedHeaders=[a-z0-9;-]*x-amz-target[a-z0-9;-]*, Signature=[0-9a-f]{64}"))
        .withRequestBody(equalToJson("""
            {"TableName": "Widgets", "Key": {"id": {"S": "1"}}, "ReturnConsumedCapacity": "NONE"}
            """)));
  }

  @Test
  void executeAsync() {
    wireMock.stubFor(post(urlEqualTo("/"))
        .willReturn(aResponse()
            .withHeader("Content-Type", CONTENT_TYPE)
            .withBody("{\"TableNames\":[\"Gadgets\",\"Widgets\"]}")));

    final Result result = client.executeAsync("ListTables", Map.of()).await();

    assertThat(result.get("TableNames")).isEqualTo(List.of("Gadgets", "Widgets"));
  }

  @Test
  void executeServiceError() {
    wireMock.stubFor(post(urlEqualTo("/"))
        .willReturn(aResponse()
            .withStatus(400)
            .withHeader("Content-Type", CONTENT_TYPE)
            .withHeader("x-amzn-RequestId", "REQ2")
            .withBody("{\"__type\":\"com.amazonaws.dynamodb.v20120810#ResourceNotFoundException\","
                + "\"message\":\"Table not found\"}")));

    final DynamoDbException exception = catchThrowableOfType(DynamoDbException.class,
        () -> client.execute("DescribeTable", Map.of("TableName", "Missing")));

    assertThat(exception.getErrorCode()).isEqualTo("ResourceNotFoundException");
    assertThat(exception.getErrorType()).isEqualTo("client");
    assertThat(exception.getErrorMessage()).isEqualTo("Table not found");
    assertThat(exception.getRequestId()).isEqualTo("REQ2");
    assertThat(exception.getStatusCode()).isEqualTo(400);
    assertThat(exception.getCommand().getName()).isEqualTo("DescribeTable");
    assertThat(exception.getMessage()).isEqualTo(String.format(
        "Error executing Amazon DynamoDB::describeTable() on \"http://localhost:%d/\"; "
            + "ResourceNotFoundException (client error): Table not found", wireMock.getPort()));

    wireMock.verify(1, postRequestedFor(urlEqualTo("/")));
  }

  @Test
  void executeServerErrorRetried() {
    wireMock.stubFor(post(urlEqualTo("/"))
        .willReturn(aResponse()
            .withStatus(500)
            .withBody("{\"__type\":\"InternalServerError\",\"message\":\"Oops\"}")));

    final DynamoDbException exception = catchThrowableOfType(DynamoDbException.class,
        () -> client.execute("ListTables", Map.of()));

    assertThat(exception.getErrorCode()).isEqualTo("InternalServerError");
    assertThat(exception.getErrorType()).isEqualTo("server");
    assertThat(exception.getStatusCode()).isEqualTo(500);

    wireMock.verify(3, postRequestedFor(urlEqualTo("/")));
  }

  @Test
  void executeUnknownOperation() {
    assertThatThrownBy(() -> client.execute("DropTable", Map.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Operation not found: DropTable");

    wireMock.verify(0, postRequestedFor(urlEqualTo("/")));
  }

  @Test
  void paginate() {
    wireMock.stubFor(post(urlEqualTo("/"))
        .withRequestBody(equalToJson("""
            {"TableName": "Widgets", "ReturnConsumedCapacity": "NONE"}
            """))
        .willReturn(aResponse()
            .withHeader("Content-Type", CONTENT_TYPE)
            .withBody("""
                {"Items": [{"id": {"S": "1"}}, {"id": {"S": "2"}}], "LastEvaluatedKey": {"id": {"S": "2"}}}
                """)));

    wireMock.stubFor(post(urlEqualTo("/"))
        .withRequestBody(equalToJson("""
            {"TableName": "Widgets", "ReturnConsumedCapacity": "NONE", "ExclusiveStartKey": {"id": {"S": "2"}}}
            """))
        .willReturn(aResponse()
            .withHeader("Content-Type", CONTENT_TYPE)
            .withBody("""
                {"Items": [{"id": {"S": "3"}}]}
                """)));

    final List<Object> ids = new ArrayList<>();
    client.getIterator("Scan", Map.of("TableName", "Widgets"))
        .forEachRemaining(item -> ids.add(((Map<?, ?>) ((Map<?, ?>) item).get("id")).get("S")));

    assertThat(ids).containsExactly("1", "2", "3");

    wireMock.verify(2, postRequestedFor(urlEqualTo("/"))
        .withHeader("X-Amz-Target", equalTo("DynamoDB_20120810.Scan")));
  }

  @Test
  void waitUntil() {
    wireMock.stubFor(post(urlEqualTo("/"))
        .inScenario("create table")
        .whenScenarioStateIs(Scenario.STARTED)
        .willSetStateTo("creating")
        .willReturn(aResponse()
            .withStatus(400)
            .withHeader("Content-Type", CONTENT_TYPE)
            .withBody("{\"__type\":\"com.amazonaws.dynamodb.v20120810#ResourceNotFoundException\"}")));

    wireMock.stubFor(post(urlEqualTo("/"))
        .inScenario("create table")
        .whenScenarioStateIs("creating")
        .willSetStateTo("active")
        .willReturn(aResponse()
            .withHeader("Content-Type", CONTENT_TYPE)
            .withBody("{\"Table\":{\"TableName\":\"Widgets\",\"TableStatus\":\"CREATING\"}}")));

    wireMock.stubFor(post(urlEqualTo("/"))
        .inScenario("create table")
        .whenScenarioStateIs("active")
        .willReturn(aResponse()
            .withHeader("Content-Type", CONTENT_TYPE)
            .withBody("{\"Table\":{\"TableName\":\"Widgets\",\"TableStatus\":\"ACTIVE\"}}")));

    final Result result = client.waitUntil("TableExists", Map.of("TableName", "Widgets"));

    assertThat(result.search("Table.TableStatus")).isEqualTo("ACTIVE");

    wireMock.verify(3, postRequestedFor(urlEqualTo("/"))
        .withHeader("X-Amz-Target", equalTo("DynamoDB_20120810.DescribeTable"))
        .withRequestBody(containing("\"TableName\":\"Widgets\"")));
  }

  @Test
  void waitUntilSucceedsOnError() {
    wireMock.stubFor(post(urlEqualTo("/"))
        .willReturn(aResponse()
            .withStatus(400)
            .withHeader("Content-Type", CONTENT_TYPE)
            .withBody("{\"__type\":\"com.amazonaws.dynamodb.v20120810#ResourceNotFoundException\"}")));

    assertThat(client.waitUntil("TableNotExists", Map.of("TableName", "Widgets"))).isNull();

    wireMock.verify(1, postRequestedFor(urlEqualTo("/")));
  }

  @Test
  void buildWithoutConfiguration() {
    assertThatThrownBy(() -> HttpServiceClients.newBuilder("buildWithoutConfiguration", dynamoDb)
        .withJsonProtocol("DynamoDB_20120810", "1.0")
        .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ServiceClientConfiguration");
  }

  @Test
  void buildWithUnknownSignatureVersion() {
    assertThatThrownBy(() -> HttpServiceClients.newBuilder("buildWithUnknownSignatureVersion", dynamoDb)
        .withConfiguration(new ServiceClientConfiguration("us-east-1", URI.create("https://dynamodb.us-east-1.amazonaws.com"),
            "v2", null, null))
        .withCredentials(CREDENTIALS)
        .withJsonProtocol("DynamoDB_20120810", "1.0")
        .build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
