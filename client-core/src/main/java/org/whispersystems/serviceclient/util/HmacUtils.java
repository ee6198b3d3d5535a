/*
 * Copyright 2023 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.serviceclient.util;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public final class HmacUtils {

  private static final HexFormat HEX = HexFormat.of();

  private static final String HMAC_SHA_256 = "HmacSHA256";
  private static final String SHA_256 = "SHA-256";

  private static final ThreadLocal<Mac> THREAD_LOCAL_HMAC_SHA_256 = ThreadLocal.withInitial(() -> {
    try {
      return Mac.getInstance(HMAC_SHA_256);
    } catch (NoSuchAlgorithmException e) {
      throw new RuntimeException(e);
    }
  });

  private static final ThreadLocal<MessageDigest> THREAD_LOCAL_SHA_256 = ThreadLocal.withInitial(() -> {
    try {
      return MessageDigest.getInstance(SHA_256);
    } catch (NoSuchAlgorithmException e) {
      throw new RuntimeException(e);
    }
  });

  private HmacUtils() {
  }

  private static Mac initializedThreadLocalMac(final byte[] key) {
    try {
      final Mac mac = THREAD_LOCAL_HMAC_SHA_256.get();
      mac.init(new SecretKeySpec(key, HMAC_SHA_256));
      return mac;
    } catch (final InvalidKeyException e) {
      throw new RuntimeException(e);
    }
  }

  public static byte[] hmac256(final byte[] key, final byte[] input) {
    return initializedThreadLocalMac(key).doFinal(input);
  }

  public static byte[] hmac256(final byte[] key, final String input) {
    return hmac256(key, input.getBytes(StandardCharsets.UTF_8));
  }

  public static String hmac256ToHexString(final byte[] key, final String input) {
    return HEX.formatHex(hmac256(key, input));
  }

  public static String sha256ToHexString(final byte[] input) {
    final MessageDigest digest = THREAD_LOCAL_SHA_256.get();
    digest.reset();
    return HEX.formatHex(digest.digest(input));
  }

  public static String sha256ToHexString(final String input) {
    return sha256ToHexString(input.getBytes(StandardCharsets.UTF_8));
  }
}
