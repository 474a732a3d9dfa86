package com.ryan.x402facilitator.escrow;

/**
 * Flush authorization nonces, keyed by (escrow, buyer, nonce). A nonce is reserved while its
 * flush is in flight and consumed only once the flush succeeded.
 */
public interface FlushNonceRegistry {

  /**
   * @return {@code false} if the nonce is consumed or reserved by another flush
   */
  boolean tryReserve(String escrow, String buyer, String nonce);

  void commit(String escrow, String buyer, String nonce);

  /**
   * Drops a reservation that did not lead to a successful flush.
   */
  void release(String escrow, String buyer, String nonce);

  boolean isConsumed(String escrow, String buyer, String nonce);
}
