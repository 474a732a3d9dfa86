package com.ryan.x402facilitator.model.deferred;

import com.ryan.x402facilitator.util.Patterns;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

/**
 * An escrow backed claim of the amount a buyer owes a seller. Vouchers sharing an {@link #id}
 * form a series; each aggregation adds one to the {@link #nonce} and carries the new running total
 * in {@link #valueAggregate}.
 */
public class Voucher {

  @NotNull
  @Pattern(regexp = Patterns.HEX_32_BYTES)
  public String id;

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String buyer;

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String seller;

  /**
   * Cumulative amount of the series, in atomic units of {@link #asset}.
   */
  @NotNull
  @Pattern(regexp = Patterns.ATOMIC_AMOUNT)
  public String valueAggregate;

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String asset;

  /**
   * Unix seconds.
   */
  @PositiveOrZero
  public long timestamp;

  @PositiveOrZero
  public long nonce;

  @NotNull
  @Pattern(regexp = Patterns.EVM_ADDRESS)
  public String escrow;

  @PositiveOrZero
  public long chainId;

  /**
   * Unix seconds.
   */
  @PositiveOrZero
  public long expiry;

  public BigInteger valueAggregateAmount() {
    return new BigInteger(valueAggregate);
  }

  public Voucher copy() {
    Voucher v = new Voucher();
    copyInto(v);
    return v;
  }

  protected void copyInto(Voucher v) {
    v.id = id;
    v.buyer = buyer;
    v.seller = seller;
    v.valueAggregate = valueAggregate;
    v.asset = asset;
    v.timestamp = timestamp;
    v.nonce = nonce;
    v.escrow = escrow;
    v.chainId = chainId;
    v.expiry = expiry;
  }

  @Override
  public String toString() {
    return "Voucher{id=" + id + ", nonce=" + nonce + ", buyer=" + buyer + ", seller=" + seller
        + ", valueAggregate=" + valueAggregate + "}";
  }
}
