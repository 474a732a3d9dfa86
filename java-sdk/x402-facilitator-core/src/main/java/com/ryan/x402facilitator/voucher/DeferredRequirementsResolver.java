package com.ryan.x402facilitator.voucher;

import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.deferred.AggregationExtra;
import com.ryan.x402facilitator.model.deferred.DeferredRequirementsExtra;
import com.ryan.x402facilitator.model.deferred.DeferredSchemePayload;
import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.model.deferred.NewVoucherExtra;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.util.Addresses;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, before the payer signs, whether a deferred payment opens a new voucher series or
 * extends the buyer's available voucher. The result is advisory: the receiving side validates the
 * signed voucher again.
 */
@Slf4j
public class DeferredRequirementsResolver {

  private final VoucherGateway gateway;
  private final boolean includeAccountDetails;

  public DeferredRequirementsResolver(VoucherGateway gateway) {
    this(gateway, false);
  }

  public DeferredRequirementsResolver(VoucherGateway gateway, boolean includeAccountDetails) {
    this.gateway = gateway;
    this.includeAccountDetails = includeAccountDetails;
  }

  public boolean includesAccountDetails() {
    return includeAccountDetails;
  }

  /**
   * @param paymentHeader X-PAYMENT value, may be {@code null}
   * @param buyerHeader X-BUYER value, may be {@code null}
   */
  public DeferredRequirementsExtra resolve(String paymentHeader, String buyerHeader,
      String seller, String asset, String escrow, long chainId) {
    String newId = VoucherIds.generate();
    Optional<String> buyer = resolveBuyer(paymentHeader, buyerHeader);
    if (buyer.isEmpty()) {
      return new NewVoucherExtra(newId, escrow, null);
    }

    EscrowAccountDetails account = lookupAccount(buyer.get(), seller, asset, escrow, chainId);
    Optional<SignedVoucher> available;
    try {
      available = gateway.getAvailableVoucher(buyer.get(), seller);
    } catch (IOException | RuntimeException ex) {
      log.warn("x402 available voucher lookup failed buyer: {} seller: {}, minting new voucher",
          buyer.get(), seller, ex);
      return new NewVoucherExtra(newId, escrow, account);
    }

    Optional<SignedVoucher> previous = available
        .filter(v -> Addresses.same(v.asset, asset))
        .filter(v -> Addresses.same(v.escrow, escrow))
        .filter(v -> v.chainId == chainId);
    if (previous.isPresent()) {
      return new AggregationExtra(previous.get(), account);
    }
    return new NewVoucherExtra(newId, escrow, account);
  }

  // X-PAYMENT wins over X-BUYER; an undecodable X-PAYMENT yields no buyer
  private Optional<String> resolveBuyer(String paymentHeader, String buyerHeader) {
    if (hasText(paymentHeader)) {
      try {
        DeferredSchemePayload payload = PaymentPayload.fromHeader(paymentHeader)
            .payloadAs(DeferredSchemePayload.class);
        if (payload.voucher == null || !Addresses.isEvmAddress(payload.voucher.buyer)) {
          return Optional.empty();
        }
        return Optional.of(payload.voucher.buyer);
      } catch (IllegalArgumentException ex) {
        log.debug("x402 payment header is not a deferred payload: {}", ex.getMessage());
        return Optional.empty();
      }
    }
    if (hasText(buyerHeader) && Addresses.isEvmAddress(buyerHeader.trim())) {
      return Optional.of(buyerHeader.trim());
    }
    return Optional.empty();
  }

  private EscrowAccountDetails lookupAccount(String buyer, String seller, String asset,
      String escrow, long chainId) {
    if (!includeAccountDetails) {
      return null;
    }
    try {
      return gateway.lookupAccountDetails(buyer, seller, asset, escrow, chainId).orElse(null);
    } catch (IOException | RuntimeException ex) {
      log.warn("x402 escrow account lookup failed buyer: {} seller: {}", buyer, seller, ex);
      return null;
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
