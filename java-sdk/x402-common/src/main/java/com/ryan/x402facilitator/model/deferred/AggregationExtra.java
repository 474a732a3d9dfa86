package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Tells the payer to extend {@link #voucher}: same series, nonce plus one, aggregate grown by at
 * least the price.
 */
public final class AggregationExtra implements DeferredRequirementsExtra {

  @NotNull
  @Pattern(regexp = Patterns.EVM_SIGNATURE)
  public String signature;

  @NotNull
  @Valid
  public Voucher voucher;

  public EscrowAccountDetails account;

  public AggregationExtra() {
  }

  public AggregationExtra(SignedVoucher previous, EscrowAccountDetails account) {
    this.signature = previous.signature;
    this.voucher = previous.unsigned();
    this.account = account;
  }

  @Override
  public Kind kind() {
    return Kind.AGGREGATION;
  }

  @Override
  public EscrowAccountDetails account() {
    return account;
  }

  public SignedVoucher previousVoucher() {
    return SignedVoucher.of(voucher, signature);
  }
}
