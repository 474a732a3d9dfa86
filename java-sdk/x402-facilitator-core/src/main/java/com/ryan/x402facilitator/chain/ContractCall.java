package com.ryan.x402facilitator.chain;

import java.util.List;

/**
 * A contract function invocation, or for SVM networks a serialized transaction.
 *
 * @param target contract address, {@code null} for a serialized transaction
 * @param function function name
 * @param arguments ABI arguments in declaration order
 */
public record ContractCall(String target, String function, List<Object> arguments) {

  public static final String SERIALIZED_TRANSACTION = "serializedTransaction";

  public ContractCall {
    arguments = List.copyOf(arguments);
  }

  public static ContractCall of(String target, String function, Object... arguments) {
    return new ContractCall(target, function, List.of(arguments));
  }

  public static ContractCall serialized(String transaction) {
    return new ContractCall(null, SERIALIZED_TRANSACTION, List.of(transaction));
  }
}
