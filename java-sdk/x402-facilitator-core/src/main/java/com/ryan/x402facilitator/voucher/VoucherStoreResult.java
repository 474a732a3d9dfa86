package com.ryan.x402facilitator.voucher;

/**
 * Outcome of a voucher store mutation. Validation failures are reported here, never thrown.
 */
public record VoucherStoreResult(boolean success, String error) {

  private static final VoucherStoreResult OK = new VoucherStoreResult(true, null);

  public static VoucherStoreResult ok() {
    return OK;
  }

  public static VoucherStoreResult failure(String error) {
    return new VoucherStoreResult(false, error);
  }
}
