package com.ryan.x402facilitator.scheme;

import com.ryan.x402facilitator.chain.ChainClient;
import com.ryan.x402facilitator.chain.ChainSigner;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.DeferredSchemePayload;
import com.ryan.x402facilitator.model.exact.ExactEvmPayload;
import com.ryan.x402facilitator.model.exact.ExactSvmPayload;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.network.NetworkRegistry;
import com.ryan.x402facilitator.scheme.deferred.DeferredEvmScheme;
import com.ryan.x402facilitator.scheme.exact.ExactEvmScheme;
import com.ryan.x402facilitator.scheme.exact.ExactSvmScheme;
import com.ryan.x402facilitator.validation.PayloadValidator;
import com.ryan.x402facilitator.voucher.VoucherStoreException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes verify and settle calls to the handler of the requirements' (scheme, network) pair.
 * Routing and payload problems come back as invalid responses, never as exceptions; only an
 * unavailable voucher store propagates.
 */
@Slf4j
public class SchemeNetworkDispatcher {

  private final NetworkRegistry networks;
  private final PayloadValidator validator;
  private final ExactEvmScheme exactEvm;
  private final ExactSvmScheme exactSvm;
  private final DeferredEvmScheme deferredEvm;

  public SchemeNetworkDispatcher(NetworkRegistry networks, PayloadValidator validator,
      ExactEvmScheme exactEvm, ExactSvmScheme exactSvm, DeferredEvmScheme deferredEvm) {
    this.networks = networks;
    this.validator = validator;
    this.exactEvm = exactEvm;
    this.exactSvm = exactSvm;
    this.deferredEvm = deferredEvm;
  }

  /**
   * @param client read access to the requirements' network, {@code null} if none is configured
   * @param context required by the deferred scheme, may be {@code null} otherwise
   */
  public VerificationResponse verify(ChainClient client, PaymentPayload payload,
      PaymentRequirements requirements, SchemeContext context) {
    String payer = Payers.of(payload);
    Routing routing = route(payload, requirements, client, context);
    if (routing.failed()) {
      return VerificationResponse.invalid(routing.error(), payer);
    }
    try {
      return switch (routing.route()) {
        case EXACT_EVM -> exactEvm.verify(client, payload,
            (ExactEvmPayload) routing.schemePayload(), requirements, routing.network());
        case EXACT_SVM -> exactSvm.verify((ChainSigner) client, payload,
            (ExactSvmPayload) routing.schemePayload(), requirements, routing.network());
        case DEFERRED_EVM -> deferredEvm.verify(client, payload,
            (DeferredSchemePayload) routing.schemePayload(), requirements, routing.network(),
            context);
      };
    } catch (VoucherStoreException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      log.error("x402 unexpected verify error route: {} payer: {}", routing.route(), payer, ex);
      return VerificationResponse.invalid(ErrorReasons.UNEXPECTED_VERIFY_ERROR, payer);
    }
  }

  /**
   * @param signer signing access to the requirements' network, {@code null} if none is configured
   */
  public SettlementResponse settle(ChainSigner signer, PaymentPayload payload,
      PaymentRequirements requirements, SchemeContext context) {
    String payer = Payers.of(payload);
    String network = requirements == null ? null : requirements.network;
    Routing routing = route(payload, requirements, signer, context);
    if (routing.failed()) {
      return SettlementResponse.failure(routing.error(), network, payer);
    }
    try {
      return switch (routing.route()) {
        case EXACT_EVM -> exactEvm.settle(signer, payload,
            (ExactEvmPayload) routing.schemePayload(), requirements, routing.network());
        case EXACT_SVM -> exactSvm.settle(signer, payload,
            (ExactSvmPayload) routing.schemePayload(), requirements, routing.network());
        case DEFERRED_EVM -> deferredEvm.settle(signer, payload,
            (DeferredSchemePayload) routing.schemePayload(), requirements, routing.network(),
            context);
      };
    } catch (VoucherStoreException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      log.error("x402 unexpected settle error route: {} payer: {}", routing.route(), payer, ex);
      return SettlementResponse.failure(ErrorReasons.UNEXPECTED_SETTLE_ERROR, network, payer);
    }
  }

  private Routing route(PaymentPayload payload, PaymentRequirements requirements,
      ChainClient client, SchemeContext context) {
    if (payload == null || requirements == null) {
      return Routing.failure(ErrorReasons.INVALID_PAYLOAD);
    }
    Optional<PaymentScheme> scheme = PaymentScheme.fromId(requirements.scheme);
    if (scheme.isEmpty()) {
      return Routing.failure(ErrorReasons.INVALID_SCHEME);
    }
    Optional<Network> network = networks.find(requirements.network);
    if (network.isEmpty()) {
      return Routing.failure(ErrorReasons.INVALID_NETWORK);
    }
    Optional<PaymentRoute> route = PaymentRoute.of(scheme.get(), network.get().family());
    if (route.isEmpty()) {
      return Routing.failure(ErrorReasons.INVALID_NETWORK);
    }

    Object schemePayload;
    try {
      schemePayload = payload.payloadAs(route.get().payloadType());
    } catch (IllegalArgumentException ex) {
      log.info("x402 payload does not decode as {}: {}", route.get(), ex.getMessage());
      return Routing.failure(ErrorReasons.INVALID_PAYLOAD);
    }
    Optional<String> violation = validator.firstViolation(schemePayload);
    if (violation.isPresent()) {
      log.info("x402 invalid {} payload: {}", route.get(), violation.get());
      return Routing.failure(ErrorReasons.INVALID_PAYLOAD);
    }

    if (client == null) {
      return Routing.failure(ErrorReasons.INVALID_NETWORK);
    }
    switch (route.get()) {
      case EXACT_SVM -> {
        if (!(client instanceof ChainSigner)) {
          return Routing.failure(ErrorReasons.EXACT_SVM_SIGNER_REQUIRED);
        }
      }
      case DEFERRED_EVM -> {
        if (context == null || context.voucherStore() == null) {
          return Routing.failure(ErrorReasons.MISSING_SCHEME_CONTEXT);
        }
      }
      case EXACT_EVM -> {
      }
    }
    return new Routing(route.get(), network.get(), schemePayload, null);
  }

  private record Routing(PaymentRoute route, Network network, Object schemePayload,
      String error) {

    static Routing failure(String error) {
      return new Routing(null, null, null, error);
    }

    boolean failed() {
      return error != null;
    }
  }
}
