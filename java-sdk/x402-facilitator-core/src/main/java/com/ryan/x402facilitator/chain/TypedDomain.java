package com.ryan.x402facilitator.chain;

/**
 * EIP-712 domain separator fields.
 */
public record TypedDomain(String name, String version, long chainId, String verifyingContract) {
}
