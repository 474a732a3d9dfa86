package com.ryan.x402facilitator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of the 402 Payment Required response.
 */
public class PaymentRequiredResponse {

  public int x402Version;
  public List<PaymentRequirements> accepts = new ArrayList<>();
  public String error;

  /**
   * Payer recovered from a rejected payment, if any.
   */
  public String payer;
}
