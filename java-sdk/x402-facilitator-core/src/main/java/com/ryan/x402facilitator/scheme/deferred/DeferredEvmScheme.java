package com.ryan.x402facilitator.scheme.deferred;

import static com.ryan.x402facilitator.model.VerificationResponse.invalid;
import static com.ryan.x402facilitator.model.VerificationResponse.valid;

import com.ryan.x402facilitator.chain.ChainClient;
import com.ryan.x402facilitator.chain.ChainSigner;
import com.ryan.x402facilitator.escrow.EscrowSettlementController;
import com.ryan.x402facilitator.escrow.EscrowVerifier;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.AggregationExtra;
import com.ryan.x402facilitator.model.deferred.DeferredRequirementsExtra;
import com.ryan.x402facilitator.model.deferred.DeferredSchemePayload;
import com.ryan.x402facilitator.model.deferred.NewVoucherExtra;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.scheme.PaymentScheme;
import com.ryan.x402facilitator.scheme.SchemeContext;
import com.ryan.x402facilitator.util.Addresses;
import com.ryan.x402facilitator.validation.PayloadValidator;
import com.ryan.x402facilitator.voucher.VoucherVerifier;
import java.math.BigInteger;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

/**
 * "deferred" on EVM networks. The payer signs a voucher against funds held in the escrow; the
 * seller collects later, possibly after many aggregations.
 */
@Slf4j
public class DeferredEvmScheme {

  private final VoucherVerifier voucherVerifier;
  private final EscrowVerifier escrowVerifier;
  private final EscrowSettlementController settlementController;
  private final PayloadValidator validator;
  private final Clock clock;

  public DeferredEvmScheme(VoucherVerifier voucherVerifier, EscrowVerifier escrowVerifier,
      EscrowSettlementController settlementController, PayloadValidator validator, Clock clock) {
    this.voucherVerifier = voucherVerifier;
    this.escrowVerifier = escrowVerifier;
    this.settlementController = settlementController;
    this.validator = validator;
    this.clock = clock;
  }

  public VerificationResponse verify(ChainClient client, PaymentPayload payload,
      DeferredSchemePayload deferred, PaymentRequirements requirements, Network network,
      SchemeContext context) {
    Voucher voucher = deferred.voucher;
    String payer = voucher.buyer;

    if (!PaymentScheme.DEFERRED.id().equals(payload.scheme)) {
      return invalid(ErrorReasons.DEFERRED_PAYLOAD_SCHEME, payer);
    }
    if (!PaymentScheme.DEFERRED.id().equals(requirements.scheme)) {
      return invalid(ErrorReasons.DEFERRED_REQUIREMENTS_SCHEME, payer);
    }
    if (!network.id().equals(payload.network)) {
      return invalid(ErrorReasons.DEFERRED_NETWORK_MISMATCH, payer);
    }
    if (voucher.chainId != network.chainId()) {
      return invalid(ErrorReasons.DEFERRED_CHAIN_ID, payer);
    }

    if (requirements.maxAmountRequired == null) {
      return invalid(ErrorReasons.INVALID_PAYMENT_REQUIREMENTS, payer);
    }
    DeferredRequirementsExtra extra;
    BigInteger required;
    try {
      extra = DeferredRequirementsExtra.from(requirements.extra);
      required = new BigInteger(requirements.maxAmountRequired);
    } catch (IllegalArgumentException ex) {
      log.info("x402 unusable deferred requirements: {}", ex.getMessage());
      return invalid(ErrorReasons.INVALID_PAYMENT_REQUIREMENTS, payer);
    }
    if (!validator.isValid(extra)) {
      return invalid(ErrorReasons.INVALID_PAYMENT_REQUIREMENTS, payer);
    }

    if (extra instanceof AggregationExtra aggregation) {
      required = required.add(aggregation.voucher.valueAggregateAmount());
    }
    if (voucher.valueAggregateAmount().compareTo(required) < 0) {
      return invalid(ErrorReasons.DEFERRED_VOUCHER_VALUE, payer);
    }
    if (!Addresses.same(voucher.seller, requirements.payTo)) {
      return invalid(ErrorReasons.DEFERRED_RECIPIENT_MISMATCH, payer);
    }
    if (!Addresses.same(voucher.asset, requirements.asset)) {
      return invalid(ErrorReasons.DEFERRED_ASSET_MISMATCH, payer);
    }

    VerificationResponse timing = voucherVerifier.verifyTiming(voucher,
        clock.instant().getEpochSecond());
    if (!timing.isValid) {
      return timing;
    }
    VerificationResponse continuity = verifyContinuity(voucher, extra);
    if (!continuity.isValid) {
      return continuity;
    }
    VerificationResponse signature = voucherVerifier.verifySignature(voucher, deferred.signature);
    if (!signature.isValid) {
      return signature;
    }

    if (extra instanceof AggregationExtra aggregation) {
      VerificationResponse available = voucherVerifier.verifyAvailability(
          aggregation.previousVoucher(), context.voucherStore());
      if (!available.isValid) {
        return available;
      }
    }

    BigInteger pendingDeposit = BigInteger.ZERO;
    if (deferred.depositAuthorization != null) {
      VerificationResponse deposit = escrowVerifier.verifyDepositAuthorization(client, voucher,
          deferred.depositAuthorization);
      if (!deposit.isValid) {
        return deposit;
      }
      pendingDeposit = deferred.depositAuthorization.depositAuthorization.amountValue();
    }

    EscrowVerifier.OnchainState onchain = escrowVerifier.verifyOnchainState(client, voucher,
        pendingDeposit);
    if (!onchain.isValid()) {
      return onchain.response();
    }
    return valid(payer);
  }

  /**
   * Deposits first when the payload carries an authorization, then collects the voucher. The
   * voucher must already be stored.
   */
  public SettlementResponse settle(ChainSigner signer, PaymentPayload payload,
      DeferredSchemePayload deferred, PaymentRequirements requirements, Network network,
      SchemeContext context) {
    VerificationResponse verified = verify(signer, payload, deferred, requirements, network,
        context);
    if (!verified.isValid) {
      return SettlementResponse.failure(verified.invalidReason, network.id(), verified.payer);
    }

    // only stored vouchers are collected; check before any deposit lands on chain
    Voucher voucher = deferred.voucher;
    if (context.voucherStore().getVoucher(voucher.id, voucher.nonce).isEmpty()) {
      return SettlementResponse.failure(ErrorReasons.VOUCHER_NOT_FOUND, network.id(),
          verified.payer);
    }

    if (deferred.depositAuthorization != null) {
      SettlementResponse deposit = settlementController.depositWithAuthorization(signer,
          deferred.voucher, deferred.depositAuthorization, false);
      if (!deposit.success) {
        return deposit.withNetwork(network.id());
      }
    }
    return settlementController.settleVoucher(signer, deferred.voucher, deferred.signature,
        context.voucherStore()).withNetwork(network.id());
  }

  private VerificationResponse verifyContinuity(Voucher voucher, DeferredRequirementsExtra extra) {
    return switch (extra.kind()) {
      case NEW -> {
        // the issued id is a suggestion; the payer may open the series under its own id
        NewVoucherExtra fresh = (NewVoucherExtra) extra;
        if (!Addresses.same(voucher.escrow, fresh.voucher.escrow)) {
          yield invalid(ErrorReasons.VOUCHER_ESCROW_MISMATCH, voucher.buyer);
        }
        yield voucherVerifier.verifyContinuity(voucher, null);
      }
      case AGGREGATION -> voucherVerifier.verifyContinuity(voucher,
          ((AggregationExtra) extra).voucher);
    };
  }
}
