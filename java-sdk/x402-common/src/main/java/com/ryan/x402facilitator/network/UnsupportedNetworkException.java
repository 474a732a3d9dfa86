package com.ryan.x402facilitator.network;

public class UnsupportedNetworkException extends IllegalArgumentException {

  public UnsupportedNetworkException(String message) {
    super(message);
  }
}
