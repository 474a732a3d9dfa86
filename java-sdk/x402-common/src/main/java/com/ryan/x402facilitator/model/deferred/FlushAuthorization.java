package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Buyer signed request to flush the escrow account. {@link #seller} and {@link #asset} narrow the
 * flush; when absent every account of the buyer on the escrow is flushed. The nonce space is
 * independent of voucher nonces.
 */
public class FlushAuthorization {

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String buyer;

  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String seller;

  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String asset;

  @NotNull
  @Pattern(regexp = Patterns.HEX_32_BYTES)
  public String nonce;

  /**
   * Absolute expiry, unix seconds.
   */
  @PositiveOrZero
  public long expiry;

  @NotNull
  @Pattern(regexp = Patterns.EVM_SIGNATURE)
  public String signature;
}
