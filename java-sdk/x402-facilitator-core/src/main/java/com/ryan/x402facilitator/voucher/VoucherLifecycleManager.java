package com.ryan.x402facilitator.voucher;

import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.model.deferred.VoucherCollection;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Validated access to the voucher store. {@link #storeVoucher} accepts a voucher only if it opens
 * a new series or is the direct successor of the series tip; validation failures are returned,
 * never thrown.
 */
@Slf4j
public class VoucherLifecycleManager implements VoucherGateway {

  public static final int DEFAULT_PAGE_LIMIT = 100;

  private final VoucherStore store;
  private final VoucherVerifier verifier;
  private final int pageLimit;

  public VoucherLifecycleManager(VoucherStore store, VoucherVerifier verifier) {
    this(store, verifier, DEFAULT_PAGE_LIMIT);
  }

  public VoucherLifecycleManager(VoucherStore store, VoucherVerifier verifier, int pageLimit) {
    this.store = store;
    this.verifier = verifier;
    this.pageLimit = pageLimit;
  }

  public VoucherStore store() {
    return store;
  }

  @Override
  public Optional<SignedVoucher> getAvailableVoucher(String buyer, String seller) {
    return store.getAvailableVoucher(buyer, seller);
  }

  public List<SignedVoucher> getVoucherSeries(String id, Integer limit, Integer offset) {
    return store.getVoucherSeries(id, limit(limit), offset(offset));
  }

  public Optional<SignedVoucher> getVoucher(String id, long nonce) {
    return store.getVoucher(id, nonce);
  }

  public List<SignedVoucher> getVouchers(VoucherQuery query, Integer limit, Integer offset) {
    return store.getVouchers(query, limit(limit), offset(offset));
  }

  public List<VoucherCollection> getVoucherCollections(String id, Long nonce, Integer limit,
      Integer offset) {
    return store.getVoucherCollections(id, nonce, limit(limit), offset(offset));
  }

  public Optional<SeriesStatus> getSeriesStatus(String id) {
    return store.getSeriesStatus(id);
  }

  public String generateVoucherId() {
    return VoucherIds.generate();
  }

  @Override
  public VoucherStoreResult storeVoucher(SignedVoucher voucher) {
    VerificationResponse shape = verifier.verifyShape(voucher);
    if (!shape.isValid) {
      return VoucherStoreResult.failure(shape.invalidReason);
    }
    VoucherStoreResult result = store.withPairLock(voucher.buyer, voucher.seller,
        () -> storeLocked(voucher));
    if (result.success()) {
      log.info("voucher stored id: {} nonce: {} buyer: {} seller: {} valueAggregate: {}",
          voucher.id, voucher.nonce, voucher.buyer, voucher.seller, voucher.valueAggregate);
    } else {
      log.info("voucher rejected id: {} nonce: {} reason: {}", voucher.id, voucher.nonce,
          result.error());
    }
    return result;
  }

  private VoucherStoreResult storeLocked(SignedVoucher voucher) {
    VerificationResponse signature = verifier.verifySignature(voucher, voucher.signature);
    if (!signature.isValid) {
      return VoucherStoreResult.failure(signature.invalidReason);
    }

    Optional<SignedVoucher> tip = store.getLatestVoucher(voucher.id);
    if (tip.isPresent()) {
      SeriesStatus status = store.getSeriesStatus(voucher.id).orElse(SeriesStatus.MINTED);
      if (status == SeriesStatus.SETTLED) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_ALREADY_SETTLED);
      }
      if (status == SeriesStatus.FLUSHED) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_FLUSHED);
      }
    }

    VerificationResponse continuity = verifier.verifyContinuity(voucher, tip.orElse(null));
    if (!continuity.isValid) {
      return VoucherStoreResult.failure(continuity.invalidReason);
    }
    return store.storeVoucher(voucher);
  }

  private int limit(Integer limit) {
    if (limit == null || limit <= 0) {
      return pageLimit;
    }
    return Math.min(limit, pageLimit);
  }

  private static int offset(Integer offset) {
    return offset == null || offset < 0 ? 0 : offset;
  }
}
