package com.ryan.x402facilitator.voucher;

import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import java.io.IOException;
import java.util.Optional;

/**
 * Voucher access for the side issuing payment requirements: either the in-process facilitator or
 * a remote one over HTTP.
 */
public interface VoucherGateway {

  Optional<SignedVoucher> getAvailableVoucher(String buyer, String seller) throws IOException;

  VoucherStoreResult storeVoucher(SignedVoucher voucher) throws IOException;

  /**
   * Escrow position advertised with the requirements. Empty when the gateway cannot read chain
   * state.
   */
  default Optional<EscrowAccountDetails> lookupAccountDetails(String buyer, String seller,
      String asset, String escrow, long chainId) throws IOException {
    return Optional.empty();
  }
}
