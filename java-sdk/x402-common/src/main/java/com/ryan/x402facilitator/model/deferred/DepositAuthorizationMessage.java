package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public class DepositAuthorizationMessage {

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String buyer;

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String seller;

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String asset;

  @NotNull
  @Pattern(regexp = Patterns.ATOMIC_AMOUNT)
  public String amount;

  @NotNull
  @Pattern(regexp = Patterns.HEX_32_BYTES)
  public String nonce;

  @PositiveOrZero
  public long expiry;

  @NotNull
  @Pattern(regexp = Patterns.EVM_SIGNATURE)
  public String signature;

  public BigInteger amountValue() {
    return new BigInteger(amount);
  }
}
