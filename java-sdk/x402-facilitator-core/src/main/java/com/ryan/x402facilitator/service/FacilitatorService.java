package com.ryan.x402facilitator.service;

import com.ryan.x402facilitator.chain.ChainClient;
import com.ryan.x402facilitator.chain.ChainConnections;
import com.ryan.x402facilitator.chain.ChainException;
import com.ryan.x402facilitator.chain.ChainSigner;
import com.ryan.x402facilitator.escrow.EscrowSettlementController;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.SupportedResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.DepositAuthorization;
import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.model.deferred.FlushAuthorization;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.model.deferred.VoucherCollection;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.network.NetworkFamily;
import com.ryan.x402facilitator.network.NetworkRegistry;
import com.ryan.x402facilitator.scheme.PaymentScheme;
import com.ryan.x402facilitator.scheme.SchemeContext;
import com.ryan.x402facilitator.scheme.SchemeNetworkDispatcher;
import com.ryan.x402facilitator.util.Addresses;
import com.ryan.x402facilitator.validation.PayloadValidator;
import com.ryan.x402facilitator.voucher.VoucherGateway;
import com.ryan.x402facilitator.voucher.VoucherLifecycleManager;
import com.ryan.x402facilitator.voucher.VoucherStoreResult;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the facilitator. Resolves networks and chain collaborators for each call and
 * hands off to the dispatcher, the voucher lifecycle manager or the escrow controller.
 */
@Slf4j
public class FacilitatorService implements VoucherGateway {

  public static final int DEFAULT_X402_VERSION = 1;

  private final NetworkRegistry networks;
  private final ChainConnections connections;
  private final SchemeNetworkDispatcher dispatcher;
  private final VoucherLifecycleManager vouchers;
  private final EscrowSettlementController escrow;
  private final PayloadValidator validator;
  private final int x402Version;

  public FacilitatorService(NetworkRegistry networks, ChainConnections connections,
      SchemeNetworkDispatcher dispatcher, VoucherLifecycleManager vouchers,
      EscrowSettlementController escrow, PayloadValidator validator, int x402Version) {
    this.networks = networks;
    this.connections = connections;
    this.dispatcher = dispatcher;
    this.vouchers = vouchers;
    this.escrow = escrow;
    this.validator = validator;
    this.x402Version = x402Version;
  }

  public VerificationResponse verify(PaymentPayload payload, PaymentRequirements requirements) {
    ChainClient client = network(requirements).flatMap(this::verifyingClient).orElse(null);
    VerificationResponse response = dispatcher.verify(client, payload, requirements, context());
    if (!response.isValid) {
      log.info("x402 verification failed network: {} reason: {} payer: {}",
          requirements == null ? null : requirements.network, response.invalidReason,
          response.payer);
    }
    return response;
  }

  public SettlementResponse settle(PaymentPayload payload, PaymentRequirements requirements) {
    ChainSigner signer = network(requirements).flatMap(connections::signer).orElse(null);
    SettlementResponse response = dispatcher.settle(signer, payload, requirements, context());
    if (!response.success) {
      log.info("x402 settlement failed network: {} reason: {} payer: {}", response.network,
          response.errorReason, response.payer);
    }
    return response;
  }

  /**
   * Exact and deferred on every enabled EVM network, exact on every enabled SVM network that has
   * a signer to pay fees.
   */
  public SupportedResponse supported() {
    SupportedResponse response = new SupportedResponse();
    networks.enabled().stream()
        .sorted(Comparator.comparing(Network::id))
        .forEach(network -> {
          if (network.family() == NetworkFamily.EVM) {
            response.kinds.add(kind(PaymentScheme.EXACT, network, null));
            response.kinds.add(kind(PaymentScheme.DEFERRED, network, null));
          } else {
            connections.signer(network).ifPresent(signer -> response.kinds.add(
                kind(PaymentScheme.EXACT, network, Map.of("feePayer", signer.address()))));
          }
        });
    return response;
  }

  public List<SignedVoucher> getVoucherSeries(String id, Integer limit, Integer offset) {
    return vouchers.getVoucherSeries(id, limit, offset);
  }

  public Optional<SignedVoucher> getVoucher(String id, long nonce) {
    return vouchers.getVoucher(id, nonce);
  }

  @Override
  public Optional<SignedVoucher> getAvailableVoucher(String buyer, String seller) {
    return vouchers.getAvailableVoucher(buyer, seller);
  }

  @Override
  public VoucherStoreResult storeVoucher(SignedVoucher voucher) {
    return vouchers.storeVoucher(voucher);
  }

  public List<VoucherCollection> getVoucherCollections(String id, Long nonce, Integer limit,
      Integer offset) {
    return vouchers.getVoucherCollections(id, nonce, limit, offset);
  }

  /**
   * Collects a stored voucher on the chain it was issued for.
   */
  public SettlementResponse settleVoucher(String id, long nonce) {
    Optional<SignedVoucher> stored = vouchers.getVoucher(id, nonce);
    if (stored.isEmpty()) {
      return SettlementResponse.failure(ErrorReasons.VOUCHER_NOT_FOUND, null, null);
    }
    SignedVoucher voucher = stored.get();
    Optional<Network> network = networks.networkFor(voucher.chainId);
    Optional<ChainSigner> signer = network.flatMap(connections::signer);
    if (signer.isEmpty()) {
      return SettlementResponse.failure(ErrorReasons.INVALID_NETWORK, null, voucher.buyer);
    }
    return escrow.settleVoucher(signer.get(), voucher.unsigned(), voucher.signature,
        vouchers.store()).withNetwork(network.get().id());
  }

  /**
   * @param buyer the buyer named by the caller, which must be the authorization's signer
   */
  public SettlementResponse flushEscrow(String buyer, FlushAuthorization authorization,
      String escrowAddress, long chainId) {
    if (authorization == null) {
      return SettlementResponse.failure(ErrorReasons.FLUSH_AUTHORIZATION_MALFORMED, null, buyer);
    }
    if (!Addresses.same(buyer, authorization.buyer)) {
      return SettlementResponse.failure(ErrorReasons.FLUSH_AUTHORIZATION_BUYER_MISMATCH, null,
          buyer);
    }
    Optional<Network> network = networks.networkFor(chainId);
    Optional<ChainSigner> signer = network.flatMap(connections::signer);
    if (signer.isEmpty()) {
      return SettlementResponse.failure(ErrorReasons.INVALID_NETWORK, null, buyer);
    }
    return escrow.flushWithAuthorization(signer.get(), authorization, escrowAddress,
        vouchers.store()).withNetwork(network.get().id());
  }

  /**
   * Funds the buyer's escrow account outside of a payment. The authorization is always verified,
   * since it did not pass through {@link #verify}.
   */
  public SettlementResponse depositWithAuthorization(Voucher voucher,
      DepositAuthorization authorization) {
    Optional<String> violation = validator.firstViolation(voucher);
    if (violation.isPresent()) {
      log.info("x402 malformed deposit voucher: {}", violation.get());
      return SettlementResponse.failure(ErrorReasons.INVALID_PAYLOAD, null,
          voucher == null ? null : voucher.buyer);
    }
    Optional<Network> network = networks.networkFor(voucher.chainId);
    Optional<ChainSigner> signer = network.flatMap(connections::signer);
    if (signer.isEmpty()) {
      return SettlementResponse.failure(ErrorReasons.INVALID_NETWORK, null, voucher.buyer);
    }
    return escrow.depositWithAuthorization(signer.get(), voucher, authorization, true)
        .withNetwork(network.get().id());
  }

  /**
   * @return empty when the chain is not enabled or has no client
   * @throws ChainException if the chain state cannot be read
   */
  public Optional<EscrowAccountDetails> getEscrowAccountDetails(String buyer, String seller,
      String asset, String escrowAddress, long chainId) throws ChainException {
    Optional<ChainClient> client = networks.networkFor(chainId).flatMap(connections::client);
    if (client.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(escrow.getEscrowAccountDetails(client.get(), vouchers.store(), buyer,
        seller, asset, escrowAddress));
  }

  @Override
  public Optional<EscrowAccountDetails> lookupAccountDetails(String buyer, String seller,
      String asset, String escrowAddress, long chainId) throws IOException {
    try {
      return getEscrowAccountDetails(buyer, seller, asset, escrowAddress, chainId);
    } catch (ChainException ex) {
      throw new IOException("escrow account read failed", ex);
    }
  }

  public String generateVoucherId() {
    return vouchers.generateVoucherId();
  }

  private Optional<Network> network(PaymentRequirements requirements) {
    return requirements == null ? Optional.empty() : networks.find(requirements.network);
  }

  /**
   * SVM verification simulates with the fee payer, so it takes the signer even when a read client
   * is configured.
   */
  private Optional<ChainClient> verifyingClient(Network network) {
    if (network.family() == NetworkFamily.SVM) {
      return connections.signer(network).map(ChainClient.class::cast);
    }
    return connections.client(network);
  }

  private SchemeContext context() {
    return new SchemeContext(vouchers.store());
  }

  private SupportedResponse.Kind kind(PaymentScheme scheme, Network network,
      Map<String, Object> extra) {
    return new SupportedResponse.Kind(x402Version, scheme.id(), network.id(), extra);
  }
}
