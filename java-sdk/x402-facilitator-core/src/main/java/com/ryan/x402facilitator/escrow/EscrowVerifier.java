package com.ryan.x402facilitator.escrow;

import static com.ryan.x402facilitator.model.VerificationResponse.invalid;
import static com.ryan.x402facilitator.model.VerificationResponse.valid;

import com.ryan.x402facilitator.chain.ChainClient;
import com.ryan.x402facilitator.chain.ChainException;
import com.ryan.x402facilitator.chain.EscrowAccount;
import com.ryan.x402facilitator.chain.SignatureVerifier;
import com.ryan.x402facilitator.chain.TypedMessages;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.DepositAuthorization;
import com.ryan.x402facilitator.model.deferred.DepositAuthorizationMessage;
import com.ryan.x402facilitator.model.deferred.DepositPermit;
import com.ryan.x402facilitator.model.deferred.FlushAuthorization;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.util.Addresses;
import java.math.BigInteger;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks of escrow artifacts against their signatures and the escrow's on-chain state.
 */
@Slf4j
public class EscrowVerifier {

  private final SignatureVerifier signatures;
  private final Clock clock;

  public EscrowVerifier(SignatureVerifier signatures, Clock clock) {
    this.signatures = signatures;
    this.clock = clock;
  }

  /**
   * @param outstanding uncollected part of the voucher, {@code null} when the check failed early
   */
  public record OnchainState(VerificationResponse response, BigInteger outstanding) {

    public boolean isValid() {
      return response.isValid;
    }
  }

  /**
   * The client must be on the voucher's chain and the buyer's escrow balance, plus a deposit
   * about to be made, must cover the outstanding amount.
   */
  public OnchainState verifyOnchainState(ChainClient client, Voucher voucher,
      BigInteger pendingDeposit) {
    String payer = voucher.buyer;
    if (client.chainId() != voucher.chainId) {
      return new OnchainState(invalid(ErrorReasons.INVALID_CLIENT_NETWORK, payer), null);
    }

    BigInteger outstanding;
    try {
      outstanding = client.getOutstandingAmount(voucher);
    } catch (ChainException ex) {
      log.warn("x402 outstanding amount read failed voucher: {} error: {}", voucher.id,
          ex.getMessage());
      return new OnchainState(
          invalid(ErrorReasons.CONTRACT_CALL_FAILED_OUTSTANDING_AMOUNT, payer), null);
    }

    EscrowAccount account;
    try {
      account = client.getEscrowAccount(voucher.escrow, voucher.buyer, voucher.seller,
          voucher.asset);
    } catch (ChainException ex) {
      log.warn("x402 escrow account read failed buyer: {} error: {}", voucher.buyer,
          ex.getMessage());
      return new OnchainState(invalid(ErrorReasons.CONTRACT_CALL_FAILED_ACCOUNT, payer), null);
    }

    if (account.balance().add(pendingDeposit).compareTo(outstanding) < 0) {
      return new OnchainState(invalid(ErrorReasons.INSUFFICIENT_FUNDS, payer), outstanding);
    }
    return new OnchainState(valid(payer), outstanding);
  }

  public VerificationResponse verifyDepositAuthorization(ChainClient client, Voucher voucher,
      DepositAuthorization authorization) {
    String payer = voucher.buyer;
    DepositAuthorizationMessage deposit = authorization.depositAuthorization;
    DepositPermit permit = authorization.permit;

    if (permit != null && !signatures.verify(
        TypedMessages.permit(permit, voucher.asset, voucher.chainId), permit.signature)
        .signedBy(voucher.buyer)) {
      return invalid(ErrorReasons.PERMIT_SIGNATURE, payer);
    }
    if (!signatures.verify(
        TypedMessages.depositAuthorization(deposit, voucher.escrow, voucher.chainId),
        deposit.signature).signedBy(voucher.buyer)) {
      return invalid(ErrorReasons.DEPOSIT_AUTHORIZATION_SIGNATURE, payer);
    }

    if (permit != null && !(Addresses.same(permit.owner, voucher.buyer)
        && Addresses.same(permit.spender, voucher.escrow)
        && new BigInteger(permit.value).compareTo(deposit.amountValue()) >= 0)) {
      return invalid(ErrorReasons.PERMIT_CONTINUITY, payer);
    }
    if (!Addresses.same(deposit.buyer, voucher.buyer)) {
      return invalid(ErrorReasons.DEPOSIT_AUTHORIZATION_BUYER_MISMATCH, payer);
    }
    if (!Addresses.same(deposit.seller, voucher.seller)
        || !Addresses.same(deposit.asset, voucher.asset)) {
      return invalid(ErrorReasons.DEPOSIT_AUTHORIZATION_CONTINUITY, payer);
    }
    if (deposit.expiry < nowSeconds()) {
      return invalid(ErrorReasons.DEPOSIT_AUTHORIZATION_EXPIRED, payer);
    }

    try {
      if (permit != null) {
        BigInteger permitNonce = client.getAssetPermitNonce(voucher.asset, voucher.buyer);
        if (!permitNonce.equals(new BigInteger(permit.nonce))) {
          return invalid(ErrorReasons.PERMIT_NONCE_INVALID, payer);
        }
      }
    } catch (ChainException ex) {
      log.warn("x402 permit nonce read failed buyer: {} error: {}", payer, ex.getMessage());
      return invalid(ErrorReasons.CONTRACT_CALL_FAILED_NONCES, payer);
    }

    try {
      if (client.isDepositAuthorizationNonceUsed(voucher.escrow, deposit.nonce)) {
        return invalid(ErrorReasons.DEPOSIT_AUTHORIZATION_NONCE_INVALID, payer);
      }
    } catch (ChainException ex) {
      log.warn("x402 deposit nonce read failed buyer: {} error: {}", payer, ex.getMessage());
      return invalid(ErrorReasons.CONTRACT_CALL_FAILED_DEPOSIT_NONCE_USED, payer);
    }

    // without a permit the escrow pulls on an existing allowance
    if (permit == null) {
      try {
        BigInteger allowance = client.getAssetAllowance(voucher.asset, voucher.buyer,
            voucher.escrow);
        if (allowance.compareTo(deposit.amountValue()) < 0) {
          return invalid(ErrorReasons.DEPOSIT_AUTHORIZATION_INSUFFICIENT_ALLOWANCE, payer);
        }
      } catch (ChainException ex) {
        log.warn("x402 allowance read failed buyer: {} error: {}", payer, ex.getMessage());
        return invalid(ErrorReasons.CONTRACT_CALL_FAILED_ALLOWANCE, payer);
      }
    }
    return valid(payer);
  }

  /**
   * Signature by the buyer and an unused on-chain nonce. Expiry is checked by the caller before
   * any chain access.
   */
  public VerificationResponse verifyFlushAuthorization(ChainClient client,
      FlushAuthorization authorization, String escrow) {
    String payer = authorization.buyer;
    if (!signatures.verify(
        TypedMessages.flushAuthorization(authorization, escrow, client.chainId()),
        authorization.signature).signedBy(authorization.buyer)) {
      return invalid(ErrorReasons.FLUSH_AUTHORIZATION_SIGNATURE, payer);
    }
    try {
      if (client.isFlushAuthorizationNonceUsed(escrow, authorization.buyer,
          authorization.nonce)) {
        return invalid(ErrorReasons.FLUSH_AUTHORIZATION_NONCE_USED, payer);
      }
    } catch (ChainException ex) {
      log.warn("x402 flush nonce read failed buyer: {} error: {}", payer, ex.getMessage());
      return invalid(ErrorReasons.FLUSH_AUTHORIZATION_FAILED, payer);
    }
    return valid(payer);
  }

  long nowSeconds() {
    return clock.instant().getEpochSecond();
  }
}
