package com.ryan.x402facilitator.voucher;

import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.model.deferred.VoucherCollection;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence for deferred vouchers, keyed by (series id, nonce) with a secondary index from a
 * (buyer, seller) pair to its available voucher.
 *
 * <p>The store owns voucher records and settlement state. Mutations of one pair are serialized
 * through {@link #withPairLock}; implementations take the same lock internally, so callers that
 * need a read-decide-write sequence wrap it in {@code withPairLock} themselves.
 *
 * <p>Implementations throw {@link VoucherStoreException} when the backing store is unavailable.
 */
public interface VoucherStore {

  Optional<SignedVoucher> getVoucher(String id, long nonce);

  /**
   * Highest nonce of the series, settled or not.
   */
  Optional<SignedVoucher> getLatestVoucher(String id);

  /**
   * Vouchers of a series in ascending nonce order.
   */
  List<SignedVoucher> getVoucherSeries(String id, int limit, int offset);

  /**
   * Vouchers matching the query, highest nonce first.
   */
  List<SignedVoucher> getVouchers(VoucherQuery query, int limit, int offset);

  /**
   * The unsettled tip of the pair's most recently written open series.
   */
  Optional<SignedVoucher> getAvailableVoucher(String buyer, String seller);

  Optional<SeriesStatus> getSeriesStatus(String id);

  /**
   * Whether the voucher was collected, directly or through a later voucher of its series.
   */
  boolean isSettled(String id, long nonce);

  /**
   * Inserts a voucher as is. Continuity is the caller's concern; the store only refuses a
   * duplicate (id, nonce) or an id owned by another pair.
   */
  VoucherStoreResult storeVoucher(SignedVoucher voucher);

  /**
   * Marks the series settled through the voucher's nonce and records the collection.
   */
  VoucherStoreResult settleVoucher(Voucher voucher, String transactionHash, BigInteger amount);

  List<VoucherCollection> getVoucherCollections(String id, Long nonce, int limit, int offset);

  /**
   * Marks the buyer's series on the escrow as flushed.
   *
   * @param seller {@code null} for every seller
   * @param asset {@code null} for every asset
   * @return number of series flushed
   */
  int flushVouchers(String buyer, String seller, String asset, String escrow);

  <T> T withPairLock(String buyer, String seller, Supplier<T> action);
}
