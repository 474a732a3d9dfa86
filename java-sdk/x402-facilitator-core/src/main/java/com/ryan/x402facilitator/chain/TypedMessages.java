package com.ryan.x402facilitator.chain;

import com.ryan.x402facilitator.model.deferred.DepositAuthorizationMessage;
import com.ryan.x402facilitator.model.deferred.DepositPermit;
import com.ryan.x402facilitator.model.deferred.FlushAuthorization;
import com.ryan.x402facilitator.model.deferred.Voucher;
import com.ryan.x402facilitator.model.exact.ExactEvmPayload;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the typed messages the payer signs. Escrow artifacts (vouchers, deposit and flush
 * authorizations) use the escrow's domain; permits and transfer authorizations use the asset's.
 */
public final class TypedMessages {

  public static final String ESCROW_DOMAIN_NAME = "DeferredPaymentEscrow";
  public static final String ESCROW_DOMAIN_VERSION = "1";

  /**
   * Flush authorizations leave seller and asset open with the zero address.
   */
  public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  static final List<TypedMessage.Field> VOUCHER = List.of(
      field("id", "bytes32"),
      field("buyer", "address"),
      field("seller", "address"),
      field("valueAggregate", "uint256"),
      field("asset", "address"),
      field("timestamp", "uint64"),
      field("nonce", "uint256"),
      field("escrow", "address"),
      field("chainId", "uint256"),
      field("expiry", "uint64"));

  static final List<TypedMessage.Field> DEPOSIT_AUTHORIZATION = List.of(
      field("buyer", "address"),
      field("seller", "address"),
      field("asset", "address"),
      field("amount", "uint256"),
      field("nonce", "bytes32"),
      field("expiry", "uint64"));

  static final List<TypedMessage.Field> FLUSH_AUTHORIZATION = List.of(
      field("buyer", "address"),
      field("seller", "address"),
      field("asset", "address"),
      field("nonce", "bytes32"),
      field("expiry", "uint64"));

  static final List<TypedMessage.Field> PERMIT = List.of(
      field("owner", "address"),
      field("spender", "address"),
      field("value", "uint256"),
      field("nonce", "uint256"),
      field("deadline", "uint256"));

  static final List<TypedMessage.Field> TRANSFER_WITH_AUTHORIZATION = List.of(
      field("from", "address"),
      field("to", "address"),
      field("value", "uint256"),
      field("validAfter", "uint256"),
      field("validBefore", "uint256"),
      field("nonce", "bytes32"));

  private TypedMessages() {
  }

  public static TypedDomain escrowDomain(String escrow, long chainId) {
    return new TypedDomain(ESCROW_DOMAIN_NAME, ESCROW_DOMAIN_VERSION, chainId, escrow);
  }

  public static TypedMessage voucher(Voucher v) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", v.id);
    m.put("buyer", v.buyer);
    m.put("seller", v.seller);
    m.put("valueAggregate", new BigInteger(v.valueAggregate));
    m.put("asset", v.asset);
    m.put("timestamp", v.timestamp);
    m.put("nonce", v.nonce);
    m.put("escrow", v.escrow);
    m.put("chainId", v.chainId);
    m.put("expiry", v.expiry);
    return new TypedMessage(escrowDomain(v.escrow, v.chainId), "Voucher", VOUCHER, m);
  }

  public static TypedMessage depositAuthorization(DepositAuthorizationMessage d, String escrow,
      long chainId) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("buyer", d.buyer);
    m.put("seller", d.seller);
    m.put("asset", d.asset);
    m.put("amount", new BigInteger(d.amount));
    m.put("nonce", d.nonce);
    m.put("expiry", d.expiry);
    return new TypedMessage(escrowDomain(escrow, chainId), "DepositAuthorization",
        DEPOSIT_AUTHORIZATION, m);
  }

  public static TypedMessage flushAuthorization(FlushAuthorization f, String escrow,
      long chainId) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("buyer", f.buyer);
    m.put("seller", f.seller == null ? ZERO_ADDRESS : f.seller);
    m.put("asset", f.asset == null ? ZERO_ADDRESS : f.asset);
    m.put("nonce", f.nonce);
    m.put("expiry", f.expiry);
    return new TypedMessage(escrowDomain(escrow, chainId), "FlushAuthorization",
        FLUSH_AUTHORIZATION, m);
  }

  public static TypedMessage permit(DepositPermit p, String asset, long chainId) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("owner", p.owner);
    m.put("spender", p.spender);
    m.put("value", new BigInteger(p.value));
    m.put("nonce", new BigInteger(p.nonce));
    m.put("deadline", BigInteger.valueOf(p.deadline));
    return new TypedMessage(new TypedDomain(p.domain.name, p.domain.version, chainId, asset),
        "Permit", PERMIT, m);
  }

  public static TypedMessage transferWithAuthorization(ExactEvmPayload.Authorization a,
      String asset, String assetName, String assetVersion, long chainId) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("from", a.from);
    m.put("to", a.to);
    m.put("value", new BigInteger(a.value));
    m.put("validAfter", new BigInteger(a.validAfter));
    m.put("validBefore", new BigInteger(a.validBefore));
    m.put("nonce", a.nonce);
    return new TypedMessage(new TypedDomain(assetName, assetVersion, chainId, asset),
        "TransferWithAuthorization", TRANSFER_WITH_AUTHORIZATION, m);
  }

  private static TypedMessage.Field field(String name, String type) {
    return new TypedMessage.Field(name, type);
  }
}
