package com.ryan.x402facilitator.model.deferred;

/**
 * Buyer's escrow position for one (seller, asset) account, as advertised to the payer so it can
 * decide whether a deposit authorization is needed.
 */
public class EscrowAccountDetails {

  /**
   * Escrow balance net of outstanding vouchers.
   */
  public String balance;

  public String assetAllowance;
  public String assetPermitNonce;

  /**
   * Facilitator the details were read from, when known.
   */
  public String facilitator;

  public EscrowAccountDetails() {
  }

  public EscrowAccountDetails(String balance, String assetAllowance, String assetPermitNonce) {
    this.balance = balance;
    this.assetAllowance = assetAllowance;
    this.assetPermitNonce = assetPermitNonce;
  }
}
