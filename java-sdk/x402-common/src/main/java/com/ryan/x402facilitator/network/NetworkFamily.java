package com.ryan.x402facilitator.network;

public enum NetworkFamily {
  EVM,
  SVM
}
