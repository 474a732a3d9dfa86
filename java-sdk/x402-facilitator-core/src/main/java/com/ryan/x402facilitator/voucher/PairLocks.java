package com.ryan.x402facilitator.voucher;

import com.ryan.x402facilitator.util.Addresses;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped reentrant locks keyed by (buyer, seller) pair. A pair always maps to the same lock;
 * unrelated pairs may share one. Addresses are compared case-insensitively.
 */
public class PairLocks {

  static final int DEFAULT_STRIPES = 256;

  private final ReentrantLock[] stripes;

  public PairLocks() {
    this(DEFAULT_STRIPES);
  }

  /**
   * @param stripes number of locks, rounded up to a power of two
   */
  public PairLocks(int stripes) {
    if (stripes < 1) {
      throw new IllegalArgumentException("stripes must be positive: " + stripes);
    }
    int size = Integer.highestOneBit(stripes);
    if (size < stripes) {
      size <<= 1;
    }
    this.stripes = new ReentrantLock[size];
    for (int i = 0; i < size; i++) {
      this.stripes[i] = new ReentrantLock();
    }
  }

  public <T> T withLock(String buyer, String seller, Supplier<T> action) {
    ReentrantLock lock = lockFor(buyer, seller);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  int stripeCount() {
    return stripes.length;
  }

  ReentrantLock lockFor(String buyer, String seller) {
    int h = key(buyer, seller).hashCode();
    return stripes[(h ^ (h >>> 16)) & (stripes.length - 1)];
  }

  static String key(String buyer, String seller) {
    return Addresses.normalize(buyer) + ":" + Addresses.normalize(seller);
  }
}
