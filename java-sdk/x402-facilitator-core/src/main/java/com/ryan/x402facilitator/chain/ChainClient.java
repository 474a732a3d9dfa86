package com.ryan.x402facilitator.chain;

import com.ryan.x402facilitator.model.deferred.Voucher;
import java.math.BigInteger;

/**
 * Read access to one chain. Implementations wrap an RPC client; every failed read is reported as
 * a {@link ChainException}.
 */
public interface ChainClient {

  /**
   * Chain the client is connected to.
   */
  long chainId();

  BigInteger getAssetBalance(String asset, String owner) throws ChainException;

  BigInteger getAssetAllowance(String asset, String owner, String spender) throws ChainException;

  /**
   * EIP-2612 nonce of {@code owner} on the asset.
   */
  BigInteger getAssetPermitNonce(String asset, String owner) throws ChainException;

  EscrowAccount getEscrowAccount(String escrow, String buyer, String seller, String asset)
      throws ChainException;

  /**
   * Amount of the voucher's aggregate the escrow has not collected yet.
   */
  BigInteger getOutstandingAmount(Voucher voucher) throws ChainException;

  boolean isDepositAuthorizationNonceUsed(String escrow, String nonce) throws ChainException;

  boolean isFlushAuthorizationNonceUsed(String escrow, String buyer, String nonce)
      throws ChainException;

  /**
   * Dry-runs a call. Returns whether it would succeed.
   */
  boolean simulate(ContractCall call) throws ChainException;
}
