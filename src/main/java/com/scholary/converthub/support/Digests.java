package com.scholary.converthub.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Hex digests used for content fingerprints and cache keys. */
public final class Digests {

  private Digests() {}

  public static String sha256Hex(byte[] data) {
    return HexFormat.of().formatHex(digest("SHA-256", data));
  }

  public static String md5Hex(String value) {
    return HexFormat.of().formatHex(digest("MD5", value.getBytes(StandardCharsets.UTF_8)));
  }

  private static byte[] digest(String algorithm, byte[] data) {
    try {
      return MessageDigest.getInstance(algorithm).digest(data);
    } catch (NoSuchAlgorithmException e) {
      // Both algorithms are mandatory on every JVM
      throw new IllegalStateException("Digest algorithm unavailable: " + algorithm, e);
    }
  }
}
