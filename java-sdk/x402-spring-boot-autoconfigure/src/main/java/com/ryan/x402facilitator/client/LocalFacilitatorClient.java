package com.ryan.x402facilitator.client;

import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.SupportedResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.service.FacilitatorService;

/**
 * Calls a facilitator running in the same application, skipping HTTP.
 */
public class LocalFacilitatorClient implements FacilitatorClient {

  private final FacilitatorService service;

  public LocalFacilitatorClient(FacilitatorService service) {
    this.service = service;
  }

  @Override
  public VerificationResponse verify(PaymentPayload payload, PaymentRequirements requirements) {
    return service.verify(payload, requirements);
  }

  @Override
  public SettlementResponse settle(PaymentPayload payload, PaymentRequirements requirements) {
    return service.settle(payload, requirements);
  }

  @Override
  public SupportedResponse supported() {
    return service.supported();
  }
}
