package com.ryan.x402facilitator.chain;

import java.math.BigInteger;

/**
 * Escrow account of a (buyer, seller, asset) triple.
 *
 * @param thawEndTime unix seconds, zero when not thawing
 */
public record EscrowAccount(BigInteger balance, BigInteger thawingAmount, long thawEndTime) {
}
