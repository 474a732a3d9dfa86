package com.ryan.x402facilitator.model.exact;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Payload for the "exact" scheme on EVM networks: an EIP-3009 transferWithAuthorization signed by
 * the payer.
 */
public class ExactEvmPayload {

  @NotNull
  @Pattern(regexp = Patterns.EVM_SIGNATURE)
  public String signature;

  @NotNull
  @Valid
  public Authorization authorization;

  public static class Authorization {

    @NotNull
    @Pattern(regexp = Patterns.EVM_ADDRESS)
    public String from;

    @NotNull
    @Pattern(regexp = Patterns.EVM_ADDRESS)
    public String to;

    @NotNull
    @Pattern(regexp = Patterns.ATOMIC_AMOUNT)
    public String value;

    @NotNull
    @Pattern(regexp = Patterns.UNSIGNED_INTEGER)
    public String validAfter;

    @NotNull
    @Pattern(regexp = Patterns.UNSIGNED_INTEGER)
    public String validBefore;

    @NotNull
    @Pattern(regexp = Patterns.HEX_32_BYTES)
    public String nonce;
  }
}
