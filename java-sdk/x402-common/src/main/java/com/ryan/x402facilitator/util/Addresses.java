package com.ryan.x402facilitator.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address helpers. Addresses are compared case-insensitively, checksums are not enforced.
 */
public final class Addresses {

  private static final Pattern EVM_ADDRESS = Pattern.compile(Patterns.EVM_ADDRESS);

  private Addresses() {
  }

  public static boolean isEvmAddress(String value) {
    return value != null && EVM_ADDRESS.matcher(value).matches();
  }

  /**
   * Lowercase form used for index keys.
   */
  public static String normalize(String address) {
    return address == null ? null : address.toLowerCase(Locale.ROOT);
  }

  public static boolean same(String a, String b) {
    return a != null && a.equalsIgnoreCase(b);
  }
}
