package com.ryan.x402facilitator.scheme;

import java.util.Arrays;
import java.util.Optional;

public enum PaymentScheme {
  EXACT("exact"),
  DEFERRED("deferred");

  private final String id;

  PaymentScheme(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static Optional<PaymentScheme> fromId(String id) {
    return Arrays.stream(values()).filter(s -> s.id.equals(id)).findFirst();
  }

  @Override
  public String toString() {
    return id;
  }
}
