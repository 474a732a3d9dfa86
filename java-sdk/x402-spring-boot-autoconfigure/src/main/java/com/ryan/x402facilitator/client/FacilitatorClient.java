package com.ryan.x402facilitator.client;

import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.SupportedResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import java.io.IOException;

/**
 * The facilitator as seen by a resource server.
 */
public interface FacilitatorClient {

  /**
   * @throws IOException if the facilitator cannot be reached or answers with an error status
   */
  VerificationResponse verify(PaymentPayload payload, PaymentRequirements requirements)
      throws IOException;

  SettlementResponse settle(PaymentPayload payload, PaymentRequirements requirements)
      throws IOException;

  SupportedResponse supported() throws IOException;
}
