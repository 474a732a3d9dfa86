package com.ryan.x402facilitator.model.deferred;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Buyer signed instruction to fund the escrow, optionally preceded by an EIP-2612 permit granting
 * the escrow the allowance to pull the funds.
 */
public class DepositAuthorization {

  @Valid
  public DepositPermit permit;

  @NotNull
  @Valid
  public DepositAuthorizationMessage depositAuthorization;
}
