package com.ryan.x402facilitator.model.exact;

import jakarta.validation.constraints.NotBlank;

/**
 * Payload for the "exact" scheme on SVM networks: a base64 encoded, partially signed transaction
 * that the facilitator co-signs as fee payer.
 */
public class ExactSvmPayload {

  @NotBlank
  public String transaction;
}
