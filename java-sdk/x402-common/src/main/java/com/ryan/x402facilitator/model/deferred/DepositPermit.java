package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * EIP-2612 permit on the asset, with the asset's own EIP-712 domain.
 */
public class DepositPermit {

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String owner;

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String spender;

  @NotNull
  @Pattern(regexp = Patterns.ATOMIC_AMOUNT)
  public String value;

  @NotNull
  @Pattern(regexp = Patterns.UNSIGNED_INTEGER)
  public String nonce;

  @PositiveOrZero
  public long deadline;

  @NotNull
  @Valid
  public PermitDomain domain;

  @NotNull
  @Pattern(regexp = Patterns.EVM_SIGNATURE)
  public String signature;

  public static class PermitDomain {

    @NotBlank
    public String name;

    @NotBlank
    public String version;
  }
}
