package com.ryan.x402facilitator.model;

/**
 * Body of POST /verify and POST /settle.
 */
public class PaymentRequest {

  public int x402Version = 1;
  public PaymentPayload paymentPayload;
  public PaymentRequirements paymentRequirements;

  public PaymentRequest() {
  }

  public PaymentRequest(PaymentPayload paymentPayload, PaymentRequirements paymentRequirements) {
    this.x402Version = paymentPayload.x402Version;
    this.paymentPayload = paymentPayload;
    this.paymentRequirements = paymentRequirements;
  }
}
