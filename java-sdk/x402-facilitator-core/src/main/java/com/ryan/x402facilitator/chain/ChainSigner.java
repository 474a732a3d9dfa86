package com.ryan.x402facilitator.chain;

/**
 * A {@link ChainClient} holding the facilitator's key, able to submit transactions.
 */
public interface ChainSigner extends ChainClient {

  /**
   * Facilitator address; on SVM networks also the fee payer.
   */
  String address();

  /**
   * Signs and submits the call.
   *
   * @return transaction hash
   * @throws ChainException if the node rejects the transaction
   */
  String submit(ContractCall call) throws ChainException;

  /**
   * Blocks until the transaction is included.
   *
   * @throws InterruptedException if the wait is interrupted; nothing is known about the outcome
   */
  TransactionReceipt waitForReceipt(String transactionHash)
      throws ChainException, InterruptedException;
}
