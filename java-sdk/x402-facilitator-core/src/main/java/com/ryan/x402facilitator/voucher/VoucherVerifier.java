package com.ryan.x402facilitator.voucher;

import static com.ryan.x402facilitator.model.VerificationResponse.invalid;
import static com.ryan.x402facilitator.model.VerificationResponse.valid;

import com.ryan.x402facilitator.chain.SignatureVerifier;
import com.ryan.x402facilitator.chain.TypedMessages;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.util.Addresses;
import com.ryan.x402facilitator.validation.PayloadValidator;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Voucher checks shared by payment verification and voucher storage, so both paths accept
 * exactly the same successors.
 */
@Slf4j
public class VoucherVerifier {

  private final SignatureVerifier signatures;
  private final PayloadValidator validator;

  public VoucherVerifier(SignatureVerifier signatures, PayloadValidator validator) {
    this.signatures = signatures;
    this.validator = validator;
  }

  public VerificationResponse verifyShape(Voucher voucher) {
    Optional<String> violation = validator.firstViolation(voucher);
    if (violation.isPresent()) {
      log.info("malformed voucher: {}", violation.get());
      return invalid(ErrorReasons.VOUCHER_MALFORMED, voucher == null ? null : voucher.buyer);
    }
    return valid(voucher.buyer);
  }

  /**
   * The signature must recover to the voucher's buyer.
   */
  public VerificationResponse verifySignature(Voucher voucher, String signature) {
    boolean signed = signatures.verify(TypedMessages.voucher(voucher), signature)
        .signedBy(voucher.buyer);
    if (!signed) {
      return invalid(ErrorReasons.DEFERRED_SIGNATURE, voucher.buyer);
    }
    return valid(voucher.buyer);
  }

  /**
   * Expiry and timestamp against the current time, unix seconds.
   */
  public VerificationResponse verifyTiming(Voucher voucher, long now) {
    if (voucher.expiry < now) {
      return invalid(ErrorReasons.VOUCHER_EXPIRED, voucher.buyer);
    }
    if (voucher.timestamp > now) {
      return invalid(ErrorReasons.VOUCHER_TIMESTAMP_TOO_EARLY, voucher.buyer);
    }
    return valid(voucher.buyer);
  }

  /**
   * Checks {@code next} may follow {@code previous} in a series. With no previous voucher,
   * {@code next} must open a series.
   */
  public VerificationResponse verifyContinuity(Voucher next, Voucher previous) {
    String payer = next.buyer;
    if (previous == null) {
      if (next.nonce != 0) {
        return invalid(ErrorReasons.VOUCHER_NON_ZERO_NONCE, payer);
      }
      if (next.valueAggregateAmount().signum() == 0) {
        return invalid(ErrorReasons.VOUCHER_ZERO_VALUE_AGGREGATE, payer);
      }
      return valid(payer);
    }

    if (next.nonce <= previous.nonce) {
      return invalid(ErrorReasons.VOUCHER_STALE_BASE, payer);
    }
    if (next.nonce != previous.nonce + 1) {
      return invalid(ErrorReasons.VOUCHER_NONCE_MISMATCH, payer);
    }
    if (!next.id.equalsIgnoreCase(previous.id)) {
      return invalid(ErrorReasons.VOUCHER_ID_MISMATCH, payer);
    }
    if (!Addresses.same(next.buyer, previous.buyer)) {
      return invalid(ErrorReasons.VOUCHER_BUYER_MISMATCH, payer);
    }
    if (!Addresses.same(next.seller, previous.seller)) {
      return invalid(ErrorReasons.VOUCHER_SELLER_MISMATCH, payer);
    }
    if (!Addresses.same(next.asset, previous.asset)) {
      return invalid(ErrorReasons.VOUCHER_ASSET_MISMATCH, payer);
    }
    if (!Addresses.same(next.escrow, previous.escrow)) {
      return invalid(ErrorReasons.VOUCHER_ESCROW_MISMATCH, payer);
    }
    if (next.chainId != previous.chainId) {
      return invalid(ErrorReasons.VOUCHER_CHAIN_ID_MISMATCH, payer);
    }
    if (next.valueAggregateAmount().compareTo(previous.valueAggregateAmount()) < 0) {
      return invalid(ErrorReasons.VOUCHER_VALUE_AGGREGATE_DECREASING, payer);
    }
    if (next.timestamp < previous.timestamp) {
      return invalid(ErrorReasons.VOUCHER_TIMESTAMP_DECREASING, payer);
    }
    if (next.expiry < previous.expiry) {
      return invalid(ErrorReasons.VOUCHER_EXPIRY_DECREASING, payer);
    }
    return valid(payer);
  }

  /**
   * The voucher must be stored, identical down to the signature.
   */
  public VerificationResponse verifyAvailability(SignedVoucher voucher, VoucherStore store) {
    Optional<SignedVoucher> stored = store.getVoucher(voucher.id, voucher.nonce);
    if (stored.isEmpty()) {
      return invalid(ErrorReasons.VOUCHER_NOT_FOUND, voucher.buyer);
    }
    if (!isDuplicate(voucher, stored.get())) {
      return invalid(ErrorReasons.VOUCHER_FOUND_NOT_DUPLICATE, voucher.buyer);
    }
    return valid(voucher.buyer);
  }

  public static boolean isDuplicate(SignedVoucher a, SignedVoucher b) {
    return a.id.equalsIgnoreCase(b.id)
        && Addresses.same(a.buyer, b.buyer)
        && Addresses.same(a.seller, b.seller)
        && a.valueAggregateAmount().equals(b.valueAggregateAmount())
        && Addresses.same(a.asset, b.asset)
        && a.timestamp == b.timestamp
        && a.nonce == b.nonce
        && Addresses.same(a.escrow, b.escrow)
        && a.chainId == b.chainId
        && a.expiry == b.expiry
        && a.signature.equalsIgnoreCase(b.signature);
  }
}
