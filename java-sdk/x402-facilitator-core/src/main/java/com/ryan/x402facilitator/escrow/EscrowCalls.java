package com.ryan.x402facilitator.escrow;

import com.ryan.x402facilitator.chain.ContractCall;
import com.ryan.x402facilitator.chain.TypedMessages;
import com.ryan.x402facilitator.model.deferred.DepositAuthorizationMessage;
import com.ryan.x402facilitator.model.deferred.DepositPermit;
import com.ryan.x402facilitator.model.deferred.FlushAuthorization;
import com.ryan.x402facilitator.model.deferred.Voucher;
import java.math.BigInteger;

/**
 * Calls on the deferred payment escrow and its assets. Struct arguments are passed as the same
 * ordered field maps the payer signed.
 */
final class EscrowCalls {

  static final String COLLECT = "collect";
  static final String DEPOSIT_WITH_AUTHORIZATION = "depositWithAuthorization";
  static final String FLUSH_WITH_AUTHORIZATION = "flushWithAuthorization";
  static final String PERMIT = "permit";

  private EscrowCalls() {
  }

  static ContractCall collect(Voucher voucher, String signature) {
    return ContractCall.of(voucher.escrow, COLLECT, TypedMessages.voucher(voucher).message(),
        signature);
  }

  static ContractCall depositWithAuthorization(String escrow, Voucher voucher,
      DepositAuthorizationMessage authorization) {
    return ContractCall.of(escrow, DEPOSIT_WITH_AUTHORIZATION,
        TypedMessages.depositAuthorization(authorization, escrow, voucher.chainId).message(),
        authorization.signature);
  }

  static ContractCall permit(String asset, DepositPermit permit) {
    return ContractCall.of(asset, PERMIT, permit.owner, permit.spender,
        new BigInteger(permit.value), BigInteger.valueOf(permit.deadline), permit.signature);
  }

  static ContractCall flushWithAuthorization(String escrow, long chainId,
      FlushAuthorization authorization) {
    return ContractCall.of(escrow, FLUSH_WITH_AUTHORIZATION,
        TypedMessages.flushAuthorization(authorization, escrow, chainId).message(),
        authorization.signature);
  }
}
