package com.ryan.x402facilitator.escrow;

import com.ryan.x402facilitator.chain.ChainClient;
import com.ryan.x402facilitator.chain.ChainException;
import com.ryan.x402facilitator.chain.ChainSigner;
import com.ryan.x402facilitator.chain.EscrowAccount;
import com.ryan.x402facilitator.chain.Transactions;
import com.ryan.x402facilitator.chain.Transactions.Outcome;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.DepositAuthorization;
import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.model.deferred.FlushAuthorization;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.util.Addresses;
import com.ryan.x402facilitator.validation.PayloadValidator;
import com.ryan.x402facilitator.voucher.SeriesStatus;
import com.ryan.x402facilitator.voucher.VoucherQuery;
import com.ryan.x402facilitator.voucher.VoucherStore;
import com.ryan.x402facilitator.voucher.VoucherStoreException;
import com.ryan.x402facilitator.voucher.VoucherStoreResult;
import com.ryan.x402facilitator.voucher.VoucherVerifier;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves funds through the escrow: deposits, voucher collection and flushes.
 *
 * <p>Voucher settlement is optimistic: state is checked under the pair lock, the collect
 * transaction is confirmed without holding it, and the store is marked only after the receipt.
 * A second settlement of the same voucher is refused while the first is in flight.
 *
 * <p>Results carry no network; callers fill it in.
 */
@Slf4j
public class EscrowSettlementController {

  private static final int ACCOUNT_VOUCHER_SCAN_LIMIT = 1000;

  private final EscrowVerifier escrowVerifier;
  private final VoucherVerifier voucherVerifier;
  private final FlushNonceRegistry flushNonces;
  private final PayloadValidator validator;
  private final Clock clock;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public EscrowSettlementController(EscrowVerifier escrowVerifier,
      VoucherVerifier voucherVerifier, FlushNonceRegistry flushNonces, PayloadValidator validator,
      Clock clock) {
    this.escrowVerifier = escrowVerifier;
    this.voucherVerifier = voucherVerifier;
    this.flushNonces = flushNonces;
    this.validator = validator;
    this.clock = clock;
  }

  public SettlementResponse depositWithAuthorization(ChainSigner signer, Voucher voucher,
      DepositAuthorization authorization, boolean reverify) {
    String payer = voucher.buyer;
    Optional<String> violation = validator.firstViolation(authorization);
    if (violation.isPresent()) {
      log.info("x402 malformed deposit authorization buyer: {} violation: {}", payer,
          violation.get());
      return SettlementResponse.failure(ErrorReasons.INVALID_PAYLOAD, null, payer);
    }
    if (reverify) {
      VerificationResponse verified = escrowVerifier.verifyDepositAuthorization(signer, voucher,
          authorization);
      if (!verified.isValid) {
        return SettlementResponse.failure(verified.invalidReason, null, payer);
      }
    }

    if (authorization.permit != null) {
      Outcome permit = Transactions.execute(signer,
          EscrowCalls.permit(voucher.asset, authorization.permit));
      if (!permit.successful()) {
        return SettlementResponse.failure(permit.errorReason(), permit.transaction(), null,
            payer);
      }
    }

    Outcome deposit = Transactions.execute(signer, EscrowCalls.depositWithAuthorization(
        voucher.escrow, voucher, authorization.depositAuthorization));
    if (!deposit.successful()) {
      return SettlementResponse.failure(deposit.errorReason(), deposit.transaction(), null,
          payer);
    }
    log.info("x402 deposit confirmed buyer: {} seller: {} amount: {} tx: {}", payer,
        voucher.seller, authorization.depositAuthorization.amount, deposit.transaction());
    return SettlementResponse.success(deposit.transaction(), null, payer);
  }

  /**
   * Collects a stored voucher. A chain failure leaves the store as it was.
   */
  public SettlementResponse settleVoucher(ChainSigner signer, Voucher voucher, String signature,
      VoucherStore store) {
    String payer = voucher.buyer;
    String slot = inFlightKey(voucher);
    if (!inFlight.add(slot)) {
      return SettlementResponse.failure(ErrorReasons.VOUCHER_SETTLEMENT_IN_PROGRESS, null, payer);
    }
    try {
      SignedVoucher signed = SignedVoucher.of(voucher, signature);
      String stateError = store.withPairLock(voucher.buyer, voucher.seller,
          () -> checkSettleable(signed, store));
      if (stateError != null) {
        return SettlementResponse.failure(stateError, null, payer);
      }

      VerificationResponse signatureCheck = voucherVerifier.verifySignature(voucher, signature);
      if (!signatureCheck.isValid) {
        return SettlementResponse.failure(signatureCheck.invalidReason, null, payer);
      }
      EscrowVerifier.OnchainState onchain = escrowVerifier.verifyOnchainState(signer, voucher,
          BigInteger.ZERO);
      if (!onchain.isValid()) {
        return SettlementResponse.failure(onchain.response().invalidReason, null, payer);
      }

      Outcome collect = Transactions.execute(signer, EscrowCalls.collect(voucher, signature));
      if (!collect.successful()) {
        return SettlementResponse.failure(collect.errorReason(), collect.transaction(), null,
            payer);
      }

      VoucherStoreResult marked;
      try {
        marked = store.withPairLock(voucher.buyer, voucher.seller,
            () -> store.settleVoucher(voucher, collect.transaction(), onchain.outstanding()));
      } catch (VoucherStoreException ex) {
        log.error("x402 voucher collected but store update failed id: {} nonce: {} tx: {}",
            voucher.id, voucher.nonce, collect.transaction(), ex);
        return SettlementResponse.failure(ErrorReasons.VOUCHER_ERROR_SETTLING_STORE,
            collect.transaction(), null, payer);
      }
      if (!marked.success()) {
        log.error("x402 voucher collected but not marked id: {} nonce: {} tx: {} reason: {}",
            voucher.id, voucher.nonce, collect.transaction(), marked.error());
        return SettlementResponse.failure(ErrorReasons.VOUCHER_COULD_NOT_SETTLE_STORE,
            collect.transaction(), null, payer);
      }
      log.info("x402 voucher settled id: {} nonce: {} amount: {} tx: {}", voucher.id,
          voucher.nonce, onchain.outstanding(), collect.transaction());
      return SettlementResponse.success(collect.transaction(), null, payer);
    } finally {
      inFlight.remove(slot);
    }
  }

  /**
   * Flushes the buyer's escrow accounts. The nonce is consumed only by a confirmed flush.
   */
  public SettlementResponse flushWithAuthorization(ChainSigner signer,
      FlushAuthorization authorization, String escrow, VoucherStore store) {
    Optional<String> violation = validator.firstViolation(authorization);
    if (violation.isPresent()) {
      log.info("x402 malformed flush authorization violation: {}", violation.get());
      return SettlementResponse.failure(ErrorReasons.FLUSH_AUTHORIZATION_MALFORMED, null,
          authorization == null ? null : authorization.buyer);
    }
    String payer = authorization.buyer;
    if (!Addresses.isEvmAddress(escrow)) {
      log.info("x402 flush rejected, escrow is not an address: {}", escrow);
      return SettlementResponse.failure(ErrorReasons.FLUSH_AUTHORIZATION_MALFORMED, null, payer);
    }
    if (authorization.expiry < clock.instant().getEpochSecond()) {
      return SettlementResponse.failure(ErrorReasons.FLUSH_AUTHORIZATION_EXPIRED, null, payer);
    }
    if (!flushNonces.tryReserve(escrow, authorization.buyer, authorization.nonce)) {
      return SettlementResponse.failure(ErrorReasons.FLUSH_AUTHORIZATION_NONCE_USED, null, payer);
    }

    boolean committed = false;
    try {
      VerificationResponse verified = escrowVerifier.verifyFlushAuthorization(signer,
          authorization, escrow);
      if (!verified.isValid) {
        return SettlementResponse.failure(verified.invalidReason, null, payer);
      }
      Outcome flush = Transactions.execute(signer,
          EscrowCalls.flushWithAuthorization(escrow, signer.chainId(), authorization));
      if (!flush.successful()) {
        return SettlementResponse.failure(flush.errorReason(), flush.transaction(), null, payer);
      }

      flushNonces.commit(escrow, authorization.buyer, authorization.nonce);
      committed = true;
      try {
        int flushed = store.flushVouchers(authorization.buyer, authorization.seller,
            authorization.asset, escrow);
        log.info("x402 escrow flushed buyer: {} series: {} tx: {}", payer, flushed,
            flush.transaction());
      } catch (VoucherStoreException ex) {
        log.error("x402 escrow flushed but store update failed buyer: {} tx: {}", payer,
            flush.transaction(), ex);
      }
      return SettlementResponse.success(flush.transaction(), null, payer);
    } finally {
      if (!committed) {
        flushNonces.release(escrow, authorization.buyer, authorization.nonce);
      }
    }
  }

  /**
   * Balance is reported net of what the buyer's open vouchers for this account still owe.
   */
  public EscrowAccountDetails getEscrowAccountDetails(ChainClient client, VoucherStore store,
      String buyer, String seller, String asset, String escrow) throws ChainException {
    EscrowAccount account = client.getEscrowAccount(escrow, buyer, seller, asset);
    List<SignedVoucher> latest = store.getVouchers(VoucherQuery.latest(buyer, seller),
        ACCOUNT_VOUCHER_SCAN_LIMIT, 0);

    BigInteger owed = BigInteger.ZERO;
    for (SignedVoucher voucher : latest) {
      if (!Addresses.same(voucher.asset, asset) || !Addresses.same(voucher.escrow, escrow)
          || voucher.chainId != client.chainId()) {
        continue;
      }
      SeriesStatus status = store.getSeriesStatus(voucher.id).orElse(SeriesStatus.SETTLED);
      if (status.isTerminal()) {
        continue;
      }
      owed = owed.add(client.getOutstandingAmount(voucher));
    }

    BigInteger balance = account.balance().subtract(owed).max(BigInteger.ZERO);
    BigInteger allowance = client.getAssetAllowance(asset, buyer, escrow);
    BigInteger permitNonce = client.getAssetPermitNonce(asset, buyer);
    return new EscrowAccountDetails(balance.toString(), allowance.toString(),
        permitNonce.toString());
  }

  private String checkSettleable(SignedVoucher voucher, VoucherStore store) {
    Optional<SignedVoucher> stored = store.getVoucher(voucher.id, voucher.nonce);
    if (stored.isEmpty()) {
      return ErrorReasons.VOUCHER_NOT_FOUND;
    }
    if (!VoucherVerifier.isDuplicate(voucher, stored.get())) {
      return ErrorReasons.VOUCHER_FOUND_NOT_DUPLICATE;
    }
    if (store.getSeriesStatus(voucher.id).orElse(null) == SeriesStatus.FLUSHED) {
      return ErrorReasons.VOUCHER_FLUSHED;
    }
    if (store.isSettled(voucher.id, voucher.nonce)) {
      return ErrorReasons.VOUCHER_ALREADY_SETTLED;
    }
    return null;
  }

  private static String inFlightKey(Voucher voucher) {
    return Addresses.normalize(voucher.id) + ":" + voucher.nonce;
  }
}
