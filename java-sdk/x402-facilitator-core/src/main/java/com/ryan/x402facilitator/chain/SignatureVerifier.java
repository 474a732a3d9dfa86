package com.ryan.x402facilitator.chain;

/**
 * EIP-712 signature recovery. Implementations must not throw for a malformed signature, they
 * report it as invalid.
 */
public interface SignatureVerifier {

  SignatureVerification verify(TypedMessage message, String signature);
}
