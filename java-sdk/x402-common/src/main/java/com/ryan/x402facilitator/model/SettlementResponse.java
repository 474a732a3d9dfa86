package com.ryan.x402facilitator.model;

/**
 * JSON returned by POST /settle on the facilitator, and by the escrow operations (deposit, flush,
 * voucher settlement) which share the same shape.
 */
public class SettlementResponse {

  public boolean success;

  /**
   * Reason for settlement failure (if success is false).
   */
  public String errorReason;

  public String payer;

  /**
   * Transaction hash, empty when nothing reached the chain.
   */
  public String transaction;

  public String network;

  public SettlementResponse() {
  }

  private SettlementResponse(boolean success, String errorReason, String payer, String transaction,
      String network) {
    this.success = success;
    this.errorReason = errorReason;
    this.payer = payer;
    this.transaction = transaction;
    this.network = network;
  }

  public static SettlementResponse success(String transaction, String network, String payer) {
    return new SettlementResponse(true, null, payer, transaction, network);
  }

  public static SettlementResponse failure(String reason, String network, String payer) {
    return new SettlementResponse(false, reason, payer, "", network);
  }

  public static SettlementResponse failure(String reason, String transaction, String network,
      String payer) {
    return new SettlementResponse(false, reason, payer, transaction == null ? "" : transaction,
        network);
  }

  public SettlementResponse withNetwork(String network) {
    return new SettlementResponse(success, errorReason, payer, transaction, network);
  }

  @Override
  public String toString() {
    return "SettlementResponse{success=" + success + ", errorReason=" + errorReason + ", payer="
        + payer + ", transaction=" + transaction + ", network=" + network + "}";
  }
}
