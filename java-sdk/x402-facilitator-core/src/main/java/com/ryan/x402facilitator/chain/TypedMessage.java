package com.ryan.x402facilitator.chain;

import java.util.List;
import java.util.Map;

/**
 * EIP-712 typed data: domain, primary type with its field list, and the message values keyed by
 * field name.
 */
public record TypedMessage(TypedDomain domain, String primaryType, List<Field> fields,
                           Map<String, Object> message) {

  public record Field(String name, String type) {
  }
}
