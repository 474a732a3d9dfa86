package com.ryan.x402facilitator.voucher;

import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.model.deferred.VoucherCollection;
import com.ryan.x402facilitator.util.Addresses;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Voucher store backed by concurrent maps. State is lost on restart; suitable for tests and
 * single-node deployments.
 */
@Slf4j
public class InMemoryVoucherStore implements VoucherStore {

  private final ConcurrentMap<String, Series> series = new ConcurrentHashMap<>();
  private final Map<String, List<String>> seriesByPair = new ConcurrentHashMap<>();
  private final Map<String, String> availableByPair = new ConcurrentHashMap<>();
  private final List<VoucherCollection> collections = new CopyOnWriteArrayList<>();
  private final PairLocks locks = new PairLocks();
  private final Clock clock;

  public InMemoryVoucherStore() {
    this(Clock.systemUTC());
  }

  public InMemoryVoucherStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<SignedVoucher> getVoucher(String id, long nonce) {
    return find(id).map(s -> s.vouchers.get(nonce)).map(SignedVoucher::copy);
  }

  @Override
  public Optional<SignedVoucher> getLatestVoucher(String id) {
    return find(id).flatMap(Series::tip).map(SignedVoucher::copy);
  }

  @Override
  public List<SignedVoucher> getVoucherSeries(String id, int limit, int offset) {
    return find(id)
        .map(s -> s.vouchers.values().stream()
            .skip(offset)
            .limit(limit)
            .map(SignedVoucher::copy)
            .collect(Collectors.toList()))
        .orElse(List.of());
  }

  @Override
  public List<SignedVoucher> getVouchers(VoucherQuery query, int limit, int offset) {
    return series.values().stream()
        .filter(s -> query.buyer() == null || Addresses.same(s.buyer, query.buyer()))
        .filter(s -> query.seller() == null || Addresses.same(s.seller, query.seller()))
        .flatMap(s -> query.latest() ? s.tip().stream() : s.vouchers.values().stream())
        .sorted(Comparator.comparingLong((SignedVoucher v) -> v.nonce)
            .thenComparingLong(v -> v.timestamp)
            .reversed())
        .skip(offset)
        .limit(limit)
        .map(SignedVoucher::copy)
        .collect(Collectors.toList());
  }

  @Override
  public Optional<SignedVoucher> getAvailableVoucher(String buyer, String seller) {
    String id = availableByPair.get(PairLocks.key(buyer, seller));
    if (id == null) {
      return Optional.empty();
    }
    return find(id).filter(Series::isAvailable).flatMap(Series::tip).map(SignedVoucher::copy);
  }

  @Override
  public Optional<SeriesStatus> getSeriesStatus(String id) {
    return find(id).map(Series::status);
  }

  @Override
  public boolean isSettled(String id, long nonce) {
    return find(id).map(s -> nonce <= s.settledThrough).orElse(false);
  }

  @Override
  public VoucherStoreResult storeVoucher(SignedVoucher voucher) {
    return withPairLock(voucher.buyer, voucher.seller, () -> {
      String id = normalizeId(voucher.id);
      // other pairs hold other locks, so a new id is claimed atomically
      Series created = new Series(voucher.buyer, voucher.seller);
      Series s = series.putIfAbsent(id, created);
      if (s == null) {
        s = created;
        seriesByPair.computeIfAbsent(pairOf(s), k -> new CopyOnWriteArrayList<>()).add(id);
      } else if (!Addresses.same(s.buyer, voucher.buyer)) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_BUYER_MISMATCH);
      } else if (!Addresses.same(s.seller, voucher.seller)) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_SELLER_MISMATCH);
      } else if (s.vouchers.containsKey(voucher.nonce)) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_ALREADY_EXISTS);
      }
      s.vouchers.put(voucher.nonce, voucher.copy());
      if (s.isAvailable()) {
        availableByPair.put(pairOf(s), id);
      }
      log.debug("stored voucher id: {} nonce: {}", voucher.id, voucher.nonce);
      return VoucherStoreResult.ok();
    });
  }

  @Override
  public VoucherStoreResult settleVoucher(Voucher voucher, String transactionHash,
      BigInteger amount) {
    Optional<Series> found = find(voucher.id);
    if (found.isEmpty()) {
      return VoucherStoreResult.failure(ErrorReasons.VOUCHER_NOT_FOUND);
    }
    Series s = found.get();
    return withPairLock(s.buyer, s.seller, () -> {
      SignedVoucher stored = s.vouchers.get(voucher.nonce);
      if (stored == null) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_NOT_FOUND);
      }
      if (s.flushed) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_FLUSHED);
      }
      if (voucher.nonce <= s.settledThrough) {
        return VoucherStoreResult.failure(ErrorReasons.VOUCHER_ALREADY_SETTLED);
      }
      s.settledThrough = voucher.nonce;
      collections.add(new VoucherCollection(stored, transactionHash, amount.toString(),
          clock.millis()));
      refreshAvailable(pairOf(s));
      return VoucherStoreResult.ok();
    });
  }

  @Override
  public List<VoucherCollection> getVoucherCollections(String id, Long nonce, int limit,
      int offset) {
    return collections.stream()
        .filter(c -> id == null || c.voucherId.equalsIgnoreCase(id))
        .filter(c -> nonce == null || c.voucherNonce == nonce)
        .skip(offset)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public int flushVouchers(String buyer, String seller, String asset, String escrow) {
    List<Series> matching = series.values().stream()
        .filter(s -> Addresses.same(s.buyer, buyer))
        .filter(s -> seller == null || Addresses.same(s.seller, seller))
        .filter(s -> s.tip()
            .map(tip -> Addresses.same(tip.escrow, escrow)
                && (asset == null || Addresses.same(tip.asset, asset)))
            .orElse(false))
        .collect(Collectors.toList());
    int flushed = 0;
    for (Series s : matching) {
      boolean changed = withPairLock(s.buyer, s.seller, () -> {
        if (s.flushed || !s.isAvailable()) {
          return false;
        }
        s.flushed = true;
        refreshAvailable(pairOf(s));
        return true;
      });
      if (changed) {
        flushed++;
      }
    }
    return flushed;
  }

  @Override
  public <T> T withPairLock(String buyer, String seller, Supplier<T> action) {
    return locks.withLock(buyer, seller, action);
  }

  // caller holds the pair lock
  private void refreshAvailable(String pair) {
    List<String> ids = new ArrayList<>(seriesByPair.getOrDefault(pair, List.of()));
    for (int i = ids.size() - 1; i >= 0; i--) {
      Series s = series.get(ids.get(i));
      if (s != null && s.isAvailable()) {
        availableByPair.put(pair, ids.get(i));
        return;
      }
    }
    availableByPair.remove(pair);
  }

  private Optional<Series> find(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(series.get(normalizeId(id)));
  }

  private static String pairOf(Series s) {
    return PairLocks.key(s.buyer, s.seller);
  }

  private static String normalizeId(String id) {
    return Addresses.normalize(id);
  }

  private static final class Series {

    final String buyer;
    final String seller;
    final ConcurrentSkipListMap<Long, SignedVoucher> vouchers = new ConcurrentSkipListMap<>();
    volatile long settledThrough = -1;
    volatile boolean flushed;

    Series(String buyer, String seller) {
      this.buyer = buyer;
      this.seller = seller;
    }

    Optional<SignedVoucher> tip() {
      return Optional.ofNullable(vouchers.lastEntry()).map(Map.Entry::getValue);
    }

    boolean isAvailable() {
      return !flushed && tip().map(t -> t.nonce > settledThrough).orElse(false);
    }

    SeriesStatus status() {
      if (flushed) {
        return SeriesStatus.FLUSHED;
      }
      long tipNonce = tip().map(t -> t.nonce).orElse(0L);
      if (tipNonce <= settledThrough) {
        return SeriesStatus.SETTLED;
      }
      return tipNonce == 0 ? SeriesStatus.MINTED : SeriesStatus.AGGREGATED;
    }
  }
}
