package com.ryan.x402facilitator.model;

/**
 * Body of the base64 X-PAYMENT-RESPONSE header returned to the payer after settlement.
 */
public class SettlementResponseHeader {

  public boolean success;
  public String transaction;
  public String network;
  public String payer;

  public SettlementResponseHeader() {
  }

  public SettlementResponseHeader(boolean success, String transaction, String network,
      String payer) {
    this.success = success;
    this.transaction = transaction;
    this.network = network;
    this.payer = payer;
  }
}
