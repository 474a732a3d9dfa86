package com.ryan.x402facilitator.voucher;

/**
 * The backing store is unavailable. Unlike validation failures this propagates to the caller.
 */
public class VoucherStoreException extends RuntimeException {

  public VoucherStoreException(String message) {
    super(message);
  }

  public VoucherStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
