package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public final class NewVoucherExtra implements DeferredRequirementsExtra {

  @NotNull
  @Valid
  public VoucherReference voucher;

  public EscrowAccountDetails account;

  public NewVoucherExtra() {
  }

  public NewVoucherExtra(String id, String escrow, EscrowAccountDetails account) {
    this.voucher = new VoucherReference(id, escrow);
    this.account = account;
  }

  @Override
  public Kind kind() {
    return Kind.NEW;
  }

  @Override
  public EscrowAccountDetails account() {
    return account;
  }

  /**
   * Id the payer must use for the new series, and the escrow backing it.
   */
  public static class VoucherReference {

    @NotNull
    @Pattern(regexp = Patterns.HEX_32_BYTES)
    public String id;

    @NotNull
    @Pattern(regexp = Patterns.EVM_ADDRESS)
    public String escrow;

    public VoucherReference() {
    }

    public VoucherReference(String id, String escrow) {
      this.id = id;
      this.escrow = escrow;
    }
  }
}
