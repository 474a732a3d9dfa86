package com.ryan.x402facilitator.escrow;

import com.ryan.x402facilitator.util.Addresses;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryFlushNonceRegistry implements FlushNonceRegistry {

  private enum State {
    RESERVED,
    CONSUMED
  }

  private final ConcurrentMap<String, State> nonces = new ConcurrentHashMap<>();

  @Override
  public boolean tryReserve(String escrow, String buyer, String nonce) {
    return nonces.putIfAbsent(key(escrow, buyer, nonce), State.RESERVED) == null;
  }

  @Override
  public void commit(String escrow, String buyer, String nonce) {
    nonces.put(key(escrow, buyer, nonce), State.CONSUMED);
  }

  @Override
  public void release(String escrow, String buyer, String nonce) {
    nonces.remove(key(escrow, buyer, nonce), State.RESERVED);
  }

  @Override
  public boolean isConsumed(String escrow, String buyer, String nonce) {
    return nonces.get(key(escrow, buyer, nonce)) == State.CONSUMED;
  }

  private static String key(String escrow, String buyer, String nonce) {
    return Addresses.normalize(escrow) + ":" + Addresses.normalize(buyer) + ":"
        + Addresses.normalize(nonce);
  }
}
