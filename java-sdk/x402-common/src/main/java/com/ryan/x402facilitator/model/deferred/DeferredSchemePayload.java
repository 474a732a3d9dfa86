package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Payload for the "deferred" scheme. The deposit authorization is only present on the first
 * voucher of a series, when the buyer's escrow account needs funding.
 */
public class DeferredSchemePayload {

  @NotNull
  @Pattern(regexp = Patterns.EVM_SIGNATURE)
  public String signature;

  @NotNull
  @Valid
  public Voucher voucher;

  @Valid
  public DepositAuthorization depositAuthorization;

  public SignedVoucher signedVoucher() {
    return SignedVoucher.of(voucher, signature);
  }
}
