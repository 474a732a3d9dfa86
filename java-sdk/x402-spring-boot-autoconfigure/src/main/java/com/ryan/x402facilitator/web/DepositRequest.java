package com.ryan.x402facilitator.web;

import com.ryan.x402facilitator.model.deferred.DepositAuthorization;
import com.ryan.x402facilitator.model.deferred.Voucher;

/**
 * Body of POST /deferred/deposits.
 */
public class DepositRequest {

  public Voucher voucher;
  public DepositAuthorization depositAuthorization;
}
