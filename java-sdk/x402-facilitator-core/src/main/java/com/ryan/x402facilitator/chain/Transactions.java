package com.ryan.x402facilitator.chain;

import com.ryan.x402facilitator.model.ErrorReasons;
import lombok.extern.slf4j.Slf4j;

/**
 * Submit-and-confirm for a single call.
 */
@Slf4j
public final class Transactions {

  private Transactions() {
  }

  /**
   * @param transaction hash, empty when nothing was submitted
   * @param errorReason {@code null} on success
   */
  public record Outcome(String transaction, String errorReason) {

    public boolean successful() {
      return errorReason == null;
    }
  }

  /**
   * Submits the call and waits for its receipt. A rejected submission is reported as
   * {@code invalid_transaction_reverted}, a failed or unknown receipt as
   * {@code invalid_transaction_state}. Never throws.
   */
  public static Outcome execute(ChainSigner signer, ContractCall call) {
    String tx;
    try {
      tx = signer.submit(call);
    } catch (ChainException ex) {
      log.warn("x402 {} submission failed target: {} error: {}", call.function(), call.target(),
          ex.getMessage());
      return new Outcome("", ErrorReasons.INVALID_TRANSACTION_REVERTED);
    }

    TransactionReceipt receipt;
    try {
      receipt = signer.waitForReceipt(tx);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("x402 {} interrupted while waiting for receipt tx: {}", call.function(), tx);
      return new Outcome(tx, ErrorReasons.INVALID_TRANSACTION_STATE);
    } catch (ChainException ex) {
      log.warn("x402 {} receipt unavailable tx: {} error: {}", call.function(), tx,
          ex.getMessage());
      return new Outcome(tx, ErrorReasons.INVALID_TRANSACTION_STATE);
    }

    if (receipt == null || !receipt.successful()) {
      log.warn("x402 {} failed on chain tx: {}", call.function(), tx);
      return new Outcome(tx, ErrorReasons.INVALID_TRANSACTION_STATE);
    }
    log.info("x402 {} confirmed tx: {}", call.function(), tx);
    return new Outcome(tx, null);
  }
}
