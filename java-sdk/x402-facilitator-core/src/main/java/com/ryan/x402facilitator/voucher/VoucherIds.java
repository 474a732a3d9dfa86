package com.ryan.x402facilitator.voucher;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Series ids: 32 random bytes, hex encoded with a 0x prefix. Not derived from the parties, so
 * ids cannot be guessed.
 */
public final class VoucherIds {

  private static final SecureRandom RANDOM = new SecureRandom();

  private VoucherIds() {
  }

  public static String generate() {
    byte[] bytes = new byte[32];
    RANDOM.nextBytes(bytes);
    return "0x" + HexFormat.of().formatHex(bytes);
  }
}
