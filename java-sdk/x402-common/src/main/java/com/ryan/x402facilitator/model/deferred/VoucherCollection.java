package com.ryan.x402facilitator.model.deferred;

/**
 * Record of one on-chain collection of a voucher.
 */
public class VoucherCollection {

  public String voucherId;
  public long voucherNonce;
  public String transactionHash;
  public String collectedAmount;
  public String asset;
  public long chainId;

  /**
   * Epoch millis.
   */
  public long collectedAt;

  public VoucherCollection() {
  }

  public VoucherCollection(Voucher voucher, String transactionHash, String collectedAmount,
      long collectedAt) {
    this.voucherId = voucher.id;
    this.voucherNonce = voucher.nonce;
    this.transactionHash = transactionHash;
    this.collectedAmount = collectedAmount;
    this.asset = voucher.asset;
    this.chainId = voucher.chainId;
    this.collectedAt = collectedAt;
  }
}
