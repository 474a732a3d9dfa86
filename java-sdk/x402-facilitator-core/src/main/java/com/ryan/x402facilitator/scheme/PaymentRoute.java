package com.ryan.x402facilitator.scheme;

import com.ryan.x402facilitator.model.deferred.DeferredSchemePayload;
import com.ryan.x402facilitator.model.exact.ExactEvmPayload;
import com.ryan.x402facilitator.model.exact.ExactSvmPayload;
import com.ryan.x402facilitator.network.NetworkFamily;
import java.util.Optional;

/**
 * Every supported (scheme, network family) combination.
 */
public enum PaymentRoute {
  EXACT_EVM(ExactEvmPayload.class),
  EXACT_SVM(ExactSvmPayload.class),
  DEFERRED_EVM(DeferredSchemePayload.class);

  private final Class<?> payloadType;

  PaymentRoute(Class<?> payloadType) {
    this.payloadType = payloadType;
  }

  public Class<?> payloadType() {
    return payloadType;
  }

  /**
   * @return empty when the scheme is not offered on the family
   */
  public static Optional<PaymentRoute> of(PaymentScheme scheme, NetworkFamily family) {
    return switch (scheme) {
      case EXACT -> switch (family) {
        case EVM -> Optional.of(EXACT_EVM);
        case SVM -> Optional.of(EXACT_SVM);
      };
      case DEFERRED -> switch (family) {
        case EVM -> Optional.of(DEFERRED_EVM);
        case SVM -> Optional.empty();
      };
    };
  }
}
