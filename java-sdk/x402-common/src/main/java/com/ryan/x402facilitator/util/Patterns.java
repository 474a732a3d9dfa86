package com.ryan.x402facilitator.util;

/**
 * Wire format patterns, shared by the bean validation annotations on the model.
 */
public final class Patterns {

  public static final String EVM_ADDRESS = "^0x[0-9a-fA-F]{40}$";
  public static final String HEX_32_BYTES = "^0x[0-9a-fA-F]{64}$";
  public static final String EVM_SIGNATURE = "^0x[0-9a-fA-F]+$";

  /**
   * Atomic amount: unsigned decimal integer of at most 18 digits.
   */
  public static final String ATOMIC_AMOUNT = "^[0-9]{1,18}$";

  public static final String UNSIGNED_INTEGER = "^[0-9]+$";

  private Patterns() {
  }
}
