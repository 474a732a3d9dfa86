package com.ryan.x402facilitator.chain;

import com.ryan.x402facilitator.util.Addresses;

/**
 * @param signer recovered address, {@code null} when the signature is not recoverable
 */
public record SignatureVerification(boolean valid, String signer) {

  public static SignatureVerification invalid() {
    return new SignatureVerification(false, null);
  }

  public boolean signedBy(String expected) {
    return valid && Addresses.same(signer, expected);
  }
}
