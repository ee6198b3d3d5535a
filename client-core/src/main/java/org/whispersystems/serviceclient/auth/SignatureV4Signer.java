/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.auth;

import com.google.common.annotations.VisibleForTesting;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.whispersystems.serviceclient.transport.ServiceRequest;
import org.whispersystems.serviceclient.util.HmacUtils;

/**
 * Signs requests with HMAC-SHA256 using a signing key scoped to a date, region and service.
 * <p>
 * The signature covers the method, path, query string, every header present on the request at signing time (other
 * than a handful that transports are free to rewrite) and a SHA-256 hash of the body. Signing replaces any previous
 * signature, so a request may be re-signed before each transmission attempt.
 */
public class SignatureV4Signer implements Signer {

  public static final String ALGORITHM = "AWS4-HMAC-SHA256";

  static final String DATE_HEADER = "X-Amz-Date";
  static final String SECURITY_TOKEN_HEADER = "X-Amz-Security-Token";
  static final String AUTHORIZATION_HEADER = "Authorization";

  private static final String TERMINATOR = "aws4_request";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

  private static final Set<String> UNSIGNED_HEADERS =
      Set.of("authorization", "connection", "content-length", "expect", "user-agent", "x-amzn-trace-id");

  private final String signingName;
  private final String region;
  private final Clock clock;

  public SignatureV4Signer(final String signingName, final String region, final Clock clock) {
    this.signingName = signingName;
    this.region = region;
    this.clock = clock;
  }

  @Override
  public void signRequest(final ServiceRequest request, final Credentials credentials) {
    final Instant now = clock.instant();
    final String timestamp = TIMESTAMP_FORMAT.format(now);
    final String date = DATE_FORMAT.format(now);

    request.removeHeader(AUTHORIZATION_HEADER);
    request.setHeader(DATE_HEADER, timestamp);

    if (credentials.sessionToken() != null) {
      request.setHeader(SECURITY_TOKEN_HEADER, credentials.sessionToken());
    } else {
      request.removeHeader(SECURITY_TOKEN_HEADER);
    }

    final SortedMap<String, String> canonicalHeaders = canonicalHeaders(request);
    final String signedHeaders = String.join(";", canonicalHeaders.keySet());
    final String scope = String.join("/", date, region, signingName, TERMINATOR);

    final String stringToSign = String.join("\n",
        ALGORITHM,
        timestamp,
        scope,
        HmacUtils.sha256ToHexString(canonicalRequest(request, canonicalHeaders, signedHeaders)));

    final String signature =
        HmacUtils.hmac256ToHexString(signingKey(credentials.secretAccessKey(), date), stringToSign);

    request.setHeader(AUTHORIZATION_HEADER, ALGORITHM
        + " Credential=" + credentials.accessKeyId() + "/" + scope
        + ", SignedHeaders=" + signedHeaders
        + ", Signature=" + signature);
  }

  @VisibleForTesting
  static String canonicalRequest(final ServiceRequest request,
      final SortedMap<String, String> canonicalHeaders,
      final String signedHeaders) {

    final StringBuilder headerBlock = new StringBuilder();
    canonicalHeaders.forEach((name, value) -> headerBlock.append(name).append(':').append(value).append('\n'));

    return request.getMethod() + "\n"
        + canonicalPath(request.getUri()) + "\n"
        + canonicalQuery(request.getUri()) + "\n"
        + headerBlock + "\n"
        + signedHeaders + "\n"
        + HmacUtils.sha256ToHexString(request.getBody());
  }

  @VisibleForTesting
  static SortedMap<String, String> canonicalHeaders(final ServiceRequest request) {
    final SortedMap<String, String> canonicalHeaders = new TreeMap<>();
    canonicalHeaders.put("host", host(request.getUri()));

    for (final Map.Entry<String, List<String>> header : request.getHeaders().entrySet()) {
      final String name = header.getKey().toLowerCase(Locale.ROOT);

      if (UNSIGNED_HEADERS.contains(name) || name.equals("host")) {
        continue;
      }

      canonicalHeaders.put(name, header.getValue().stream()
          .map(value -> value.trim().replaceAll("\\s+", " "))
          .collect(Collectors.joining(",")));
    }

    return canonicalHeaders;
  }

  private byte[] signingKey(final String secretAccessKey, final String date) {
    final byte[] dateKey = HmacUtils.hmac256(("AWS4" + secretAccessKey).getBytes(StandardCharsets.UTF_8), date);
    final byte[] regionKey = HmacUtils.hmac256(dateKey, region);
    final byte[] serviceKey = HmacUtils.hmac256(regionKey, signingName);

    return HmacUtils.hmac256(serviceKey, TERMINATOR);
  }

  private static String host(final URI uri) {
    final int port = uri.getPort();
    final boolean defaultPort = port == -1
        || ("https".equalsIgnoreCase(uri.getScheme()) && port == 443)
        || ("http".equalsIgnoreCase(uri.getScheme()) && port == 80);

    return defaultPort ? uri.getHost() : uri.getHost() + ":" + port;
  }

  private static String canonicalPath(final URI uri) {
    final String path = uri.getRawPath();

    if (path == null || path.isEmpty()) {
      return "/";
    }

    return Arrays.stream(path.split("/", -1))
        .map(SignatureV4Signer::encode)
        .collect(Collectors.joining("/"));
  }

  private static String canonicalQuery(final URI uri) {
    final String query = uri.getRawQuery();

    if (query == null || query.isEmpty()) {
      return "";
    }

    final List<String[]> parameters = new ArrayList<>();
    for (final String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }

      final int equals = pair.indexOf('=');
      final String name = equals < 0 ? pair : pair.substring(0, equals);
      final String value = equals < 0 ? "" : pair.substring(equals + 1);

      parameters.add(new String[]{
          encode(URLDecoder.decode(name, StandardCharsets.UTF_8)),
          encode(URLDecoder.decode(value, StandardCharsets.UTF_8))});
    }

    return parameters.stream()
        .sorted((a, b) -> a[0].equals(b[0]) ? a[1].compareTo(b[1]) : a[0].compareTo(b[0]))
        .map(parameter -> parameter[0] + "=" + parameter[1])
        .collect(Collectors.joining("&"));
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("*", "%2A")
        .replace("%7E", "~");
  }
}
