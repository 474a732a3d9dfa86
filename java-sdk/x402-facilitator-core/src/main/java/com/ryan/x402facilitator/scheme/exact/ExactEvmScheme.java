package com.ryan.x402facilitator.scheme.exact;

import static com.ryan.x402facilitator.model.VerificationResponse.invalid;
import static com.ryan.x402facilitator.model.VerificationResponse.valid;

import com.ryan.x402facilitator.chain.ChainClient;
import com.ryan.x402facilitator.chain.ChainException;
import com.ryan.x402facilitator.chain.ChainSigner;
import com.ryan.x402facilitator.chain.ContractCall;
import com.ryan.x402facilitator.chain.SignatureVerifier;
import com.ryan.x402facilitator.chain.Transactions;
import com.ryan.x402facilitator.chain.TypedMessages;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.exact.ExactEvmPayload;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.scheme.PaymentScheme;
import com.ryan.x402facilitator.util.Addresses;
import java.math.BigInteger;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

/**
 * "exact" on EVM networks: an EIP-3009 transferWithAuthorization of the asset, executed by the
 * facilitator.
 */
@Slf4j
public class ExactEvmScheme {

  static final String TRANSFER_WITH_AUTHORIZATION = "transferWithAuthorization";

  /**
   * Seconds of validity the authorization must still have, covering submission and confirmation.
   */
  static final long VALID_BEFORE_MARGIN_SECONDS = 6;

  private final SignatureVerifier signatures;
  private final Clock clock;

  public ExactEvmScheme(SignatureVerifier signatures, Clock clock) {
    this.signatures = signatures;
    this.clock = clock;
  }

  public VerificationResponse verify(ChainClient client, PaymentPayload payload,
      ExactEvmPayload exact, PaymentRequirements requirements, Network network) {
    ExactEvmPayload.Authorization auth = exact.authorization;
    String payer = auth.from;

    if (!PaymentScheme.EXACT.id().equals(payload.scheme)
        || !PaymentScheme.EXACT.id().equals(requirements.scheme)) {
      return invalid(ErrorReasons.INVALID_SCHEME, payer);
    }
    if (!network.id().equals(payload.network)) {
      return invalid(ErrorReasons.INVALID_NETWORK, payer);
    }
    if (client.chainId() != network.chainId()) {
      return invalid(ErrorReasons.INVALID_CLIENT_NETWORK, payer);
    }

    // EIP-712 domain of the asset contract
    String name = extraString(requirements, "name");
    String version = extraString(requirements, "version");
    if (name == null || version == null || requirements.maxAmountRequired == null) {
      return invalid(ErrorReasons.INVALID_PAYMENT_REQUIREMENTS, payer);
    }

    boolean signed = signatures.verify(TypedMessages.transferWithAuthorization(auth,
        requirements.asset, name, version, network.chainId()), exact.signature).signedBy(auth.from);
    if (!signed) {
      return invalid(ErrorReasons.EXACT_EVM_SIGNATURE, payer);
    }
    if (!Addresses.same(auth.to, requirements.payTo)) {
      return invalid(ErrorReasons.EXACT_EVM_RECIPIENT_MISMATCH, payer);
    }

    BigInteger now = BigInteger.valueOf(clock.instant().getEpochSecond());
    if (new BigInteger(auth.validBefore)
        .compareTo(now.add(BigInteger.valueOf(VALID_BEFORE_MARGIN_SECONDS))) <= 0) {
      return invalid(ErrorReasons.EXACT_EVM_VALID_BEFORE, payer);
    }
    if (new BigInteger(auth.validAfter).compareTo(now) > 0) {
      return invalid(ErrorReasons.EXACT_EVM_VALID_AFTER, payer);
    }

    BigInteger value = new BigInteger(auth.value);
    try {
      BigInteger balance = client.getAssetBalance(requirements.asset, auth.from);
      if (balance.compareTo(value) < 0) {
        return invalid(ErrorReasons.INSUFFICIENT_FUNDS, payer);
      }
    } catch (ChainException ex) {
      log.warn("x402 balance read failed payer: {} asset: {} error: {}", payer,
          requirements.asset, ex.getMessage());
      return invalid(ErrorReasons.UNEXPECTED_VERIFY_ERROR, payer);
    }
    if (value.compareTo(new BigInteger(requirements.maxAmountRequired)) < 0) {
      return invalid(ErrorReasons.EXACT_EVM_VALUE, payer);
    }
    return valid(payer);
  }

  public SettlementResponse settle(ChainSigner signer, PaymentPayload payload,
      ExactEvmPayload exact, PaymentRequirements requirements, Network network) {
    VerificationResponse verified = verify(signer, payload, exact, requirements, network);
    if (!verified.isValid) {
      return SettlementResponse.failure(verified.invalidReason, network.id(), verified.payer);
    }

    ExactEvmPayload.Authorization auth = exact.authorization;
    ContractCall transfer = ContractCall.of(requirements.asset, TRANSFER_WITH_AUTHORIZATION,
        auth.from, auth.to, new BigInteger(auth.value), new BigInteger(auth.validAfter),
        new BigInteger(auth.validBefore), auth.nonce, exact.signature);
    Transactions.Outcome outcome = Transactions.execute(signer, transfer);
    if (!outcome.successful()) {
      return SettlementResponse.failure(outcome.errorReason(), outcome.transaction(),
          network.id(), auth.from);
    }
    return SettlementResponse.success(outcome.transaction(), network.id(), auth.from);
  }

  private static String extraString(PaymentRequirements requirements, String key) {
    if (requirements.extra == null) {
      return null;
    }
    Object value = requirements.extra.get(key);
    return value instanceof String s ? s : null;
  }
}
