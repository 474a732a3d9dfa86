package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * A voucher together with the buyer's EIP-712 signature over it. This is the unit the voucher
 * store keeps.
 */
public class SignedVoucher extends Voucher {

  @NotNull
  @Pattern(regexp = Patterns.EVM_SIGNATURE)
  public String signature;

  public static SignedVoucher of(Voucher voucher, String signature) {
    SignedVoucher sv = new SignedVoucher();
    voucher.copyInto(sv);
    sv.signature = signature;
    return sv;
  }

  public Voucher unsigned() {
    Voucher v = new Voucher();
    copyInto(v);
    return v;
  }

  @Override
  public SignedVoucher copy() {
    return of(this, signature);
  }
}
