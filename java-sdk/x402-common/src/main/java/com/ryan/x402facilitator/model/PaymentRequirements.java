package com.ryan.x402facilitator.model;

import java.util.HashMap;
import java.util.Map;

/**
 * A resource's payment demand, sent to the payer inside a 402 response. Immutable once issued for
 * a given request.
 */
public class PaymentRequirements {

  /**
   * "exact" or "deferred".
   */
  public String scheme;

  /**
   * Network identifier, e.g. base-sepolia
   */
  public String network;

  /**
   * Amount in atomic units of the asset, as a decimal string.
   */
  public String maxAmountRequired;

  public String asset;
  public String payTo;
  public String resource;
  public String description;
  public String mimeType;
  public int maxTimeoutSeconds;
  public Map<String, Object> outputSchema;

  /**
   * Scheme specific context. For the deferred scheme this is a
   * {@link com.ryan.x402facilitator.model.deferred.DeferredRequirementsExtra}.
   */
  public Map<String, Object> extra = new HashMap<>();

  public PaymentRequirements copy() {
    PaymentRequirements pr = new PaymentRequirements();
    pr.scheme = scheme;
    pr.network = network;
    pr.maxAmountRequired = maxAmountRequired;
    pr.asset = asset;
    pr.payTo = payTo;
    pr.resource = resource;
    pr.description = description;
    pr.mimeType = mimeType;
    pr.maxTimeoutSeconds = maxTimeoutSeconds;
    pr.outputSchema = outputSchema == null ? null : new HashMap<>(outputSchema);
    pr.extra = extra == null ? null : new HashMap<>(extra);
    return pr;
  }
}
