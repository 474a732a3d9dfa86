package com.ryan.x402facilitator.chain;

/**
 * A chain read or a transaction submission failed.
 */
public class ChainException extends Exception {

  public ChainException(String message) {
    super(message);
  }

  public ChainException(String message, Throwable cause) {
    super(message, cause);
  }
}
