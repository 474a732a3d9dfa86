package com.ryan.x402facilitator.scheme;

import com.ryan.x402facilitator.model.PaymentPayload;
import java.util.Map;

/**
 * Best effort payer lookup on an undecoded payload, for error responses.
 */
final class Payers {

  private Payers() {
  }

  static String of(PaymentPayload payload) {
    if (payload == null || payload.payload == null) {
      return null;
    }
    Object authorization = payload.payload.get("authorization");
    if (authorization instanceof Map<?, ?> auth && auth.get("from") instanceof String from) {
      return from;
    }
    Object voucher = payload.payload.get("voucher");
    if (voucher instanceof Map<?, ?> v && v.get("buyer") instanceof String buyer) {
      return buyer;
    }
    return null;
  }
}
