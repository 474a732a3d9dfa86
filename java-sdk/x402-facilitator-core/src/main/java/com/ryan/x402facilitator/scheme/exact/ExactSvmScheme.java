package com.ryan.x402facilitator.scheme.exact;

import static com.ryan.x402facilitator.model.VerificationResponse.invalid;
import static com.ryan.x402facilitator.model.VerificationResponse.valid;

import com.ryan.x402facilitator.chain.ChainException;
import com.ryan.x402facilitator.chain.ChainSigner;
import com.ryan.x402facilitator.chain.ContractCall;
import com.ryan.x402facilitator.chain.Transactions;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.exact.ExactSvmPayload;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.scheme.PaymentScheme;
import lombok.extern.slf4j.Slf4j;

/**
 * "exact" on SVM networks. The payer sends a partially signed transfer transaction; the
 * facilitator co-signs as fee payer, so even verification needs the signer.
 */
@Slf4j
public class ExactSvmScheme {

  public VerificationResponse verify(ChainSigner signer, PaymentPayload payload,
      ExactSvmPayload svm, PaymentRequirements requirements, Network network) {
    if (!PaymentScheme.EXACT.id().equals(payload.scheme)
        || !PaymentScheme.EXACT.id().equals(requirements.scheme)) {
      return invalid(ErrorReasons.INVALID_SCHEME, null);
    }
    if (!network.id().equals(payload.network)) {
      return invalid(ErrorReasons.INVALID_NETWORK, null);
    }
    if (signer.chainId() != network.chainId()) {
      return invalid(ErrorReasons.INVALID_CLIENT_NETWORK, null);
    }
    try {
      if (!signer.simulate(ContractCall.serialized(svm.transaction))) {
        return invalid(ErrorReasons.EXACT_SVM_SIMULATION_FAILED, null);
      }
    } catch (ChainException ex) {
      log.warn("x402 svm simulation failed network: {} error: {}", network, ex.getMessage());
      return invalid(ErrorReasons.EXACT_SVM_SIMULATION_FAILED, null);
    }
    return valid(null);
  }

  public SettlementResponse settle(ChainSigner signer, PaymentPayload payload,
      ExactSvmPayload svm, PaymentRequirements requirements, Network network) {
    VerificationResponse verified = verify(signer, payload, svm, requirements, network);
    if (!verified.isValid) {
      return SettlementResponse.failure(verified.invalidReason, network.id(), null);
    }
    Transactions.Outcome outcome = Transactions.execute(signer,
        ContractCall.serialized(svm.transaction));
    if (!outcome.successful()) {
      return SettlementResponse.failure(outcome.errorReason(), outcome.transaction(),
          network.id(), null);
    }
    return SettlementResponse.success(outcome.transaction(), network.id(), null);
  }
}
