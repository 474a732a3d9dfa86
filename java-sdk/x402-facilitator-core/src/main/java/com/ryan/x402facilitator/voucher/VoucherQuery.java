package com.ryan.x402facilitator.voucher;

/**
 * Filter for {@link VoucherStore#getVouchers}. Null parties match everything.
 *
 * @param latest only the tip of each series
 */
public record VoucherQuery(String buyer, String seller, boolean latest) {

  public static VoucherQuery latest(String buyer, String seller) {
    return new VoucherQuery(buyer, seller, true);
  }
}
