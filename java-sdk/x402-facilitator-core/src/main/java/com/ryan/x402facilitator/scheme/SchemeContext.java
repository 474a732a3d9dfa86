package com.ryan.x402facilitator.scheme;

import com.ryan.x402facilitator.voucher.VoucherStore;

/**
 * State a scheme needs beyond the chain. Only the deferred scheme uses it.
 */
public record SchemeContext(VoucherStore voucherStore) {
}
