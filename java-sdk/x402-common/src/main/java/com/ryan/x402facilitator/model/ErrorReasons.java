package com.ryan.x402facilitator.model;

/**
 * Reasons reported in {@link VerificationResponse#invalidReason} and
 * {@link SettlementResponse#errorReason}.
 */
public final class ErrorReasons {

  // routing
  public static final String INVALID_SCHEME = "invalid_scheme";
  public static final String INVALID_NETWORK = "invalid_network";
  public static final String MISSING_SCHEME_CONTEXT = "missing_scheme_context";
  public static final String UNSUPPORTED_SCHEME = "unsupported_scheme";

  // generic
  public static final String INVALID_PAYLOAD = "invalid_payload";
  public static final String INVALID_PAYMENT_REQUIREMENTS = "invalid_payment_requirements";
  public static final String INVALID_CLIENT_NETWORK = "invalid_client_network";
  public static final String INSUFFICIENT_FUNDS = "insufficient_funds";
  public static final String INVALID_TRANSACTION_STATE = "invalid_transaction_state";
  public static final String INVALID_TRANSACTION_REVERTED = "invalid_transaction_reverted";
  public static final String UNEXPECTED_VERIFY_ERROR = "unexpected_verify_error";
  public static final String UNEXPECTED_SETTLE_ERROR = "unexpected_settle_error";

  // exact
  public static final String EXACT_EVM_SIGNATURE = "invalid_exact_evm_payload_signature";
  public static final String EXACT_EVM_RECIPIENT_MISMATCH =
      "invalid_exact_evm_payload_recipient_mismatch";
  public static final String EXACT_EVM_VALUE = "invalid_exact_evm_payload_authorization_value";
  public static final String EXACT_EVM_VALID_AFTER =
      "invalid_exact_evm_payload_authorization_valid_after";
  public static final String EXACT_EVM_VALID_BEFORE =
      "invalid_exact_evm_payload_authorization_valid_before";
  public static final String EXACT_SVM_SIGNER_REQUIRED = "invalid_exact_svm_signer_required";
  public static final String EXACT_SVM_SIMULATION_FAILED =
      "invalid_exact_svm_payload_transaction_simulation_failed";

  // deferred: requirements
  public static final String DEFERRED_PAYLOAD_SCHEME = "invalid_deferred_evm_payload_scheme";
  public static final String DEFERRED_REQUIREMENTS_SCHEME =
      "invalid_deferred_evm_requirements_scheme";
  public static final String DEFERRED_NETWORK_MISMATCH =
      "invalid_deferred_evm_payload_network_mismatch";
  public static final String DEFERRED_CHAIN_ID = "invalid_deferred_evm_payload_chain_id";
  public static final String DEFERRED_VOUCHER_VALUE = "invalid_deferred_evm_payload_voucher_value";
  public static final String DEFERRED_RECIPIENT_MISMATCH =
      "invalid_deferred_evm_payload_recipient_mismatch";
  public static final String DEFERRED_ASSET_MISMATCH =
      "invalid_deferred_evm_payload_asset_mismatch";
  public static final String DEFERRED_SIGNATURE = "invalid_deferred_evm_payload_signature";

  // deferred: voucher continuity
  public static final String VOUCHER_MALFORMED = "invalid_deferred_evm_payload_voucher_malformed";
  public static final String VOUCHER_EXPIRED = "invalid_deferred_evm_payload_voucher_expired";
  public static final String VOUCHER_TIMESTAMP_TOO_EARLY =
      "invalid_deferred_evm_payload_timestamp_too_early";
  public static final String VOUCHER_NON_ZERO_NONCE =
      "invalid_deferred_evm_payload_voucher_non_zero_nonce";
  public static final String VOUCHER_ZERO_VALUE_AGGREGATE =
      "invalid_deferred_evm_payload_voucher_zero_value_aggregate";
  public static final String VOUCHER_ID_MISMATCH = "invalid_deferred_evm_payload_voucher_id_mismatch";
  public static final String VOUCHER_BUYER_MISMATCH =
      "invalid_deferred_evm_payload_voucher_buyer_mismatch";
  public static final String VOUCHER_SELLER_MISMATCH =
      "invalid_deferred_evm_payload_voucher_seller_mismatch";
  public static final String VOUCHER_ASSET_MISMATCH =
      "invalid_deferred_evm_payload_voucher_asset_mismatch";
  public static final String VOUCHER_ESCROW_MISMATCH =
      "invalid_deferred_evm_payload_voucher_escrow_mismatch";
  public static final String VOUCHER_CHAIN_ID_MISMATCH =
      "invalid_deferred_evm_payload_voucher_chain_id_mismatch";
  public static final String VOUCHER_NONCE_MISMATCH =
      "invalid_deferred_evm_payload_voucher_nonce_mismatch";
  public static final String VOUCHER_STALE_BASE = "invalid_deferred_evm_payload_voucher_stale_base";
  public static final String VOUCHER_VALUE_AGGREGATE_DECREASING =
      "invalid_deferred_evm_payload_voucher_value_aggregate_decreasing";
  public static final String VOUCHER_TIMESTAMP_DECREASING =
      "invalid_deferred_evm_payload_voucher_timestamp_decreasing";
  public static final String VOUCHER_EXPIRY_DECREASING =
      "invalid_deferred_evm_payload_voucher_expiry_decreasing";

  // deferred: store
  public static final String VOUCHER_NOT_FOUND = "invalid_deferred_evm_payload_voucher_not_found";
  public static final String VOUCHER_FOUND_NOT_DUPLICATE =
      "invalid_deferred_evm_payload_voucher_found_not_duplicate";
  public static final String VOUCHER_ALREADY_EXISTS =
      "invalid_deferred_evm_payload_voucher_already_exists";
  public static final String VOUCHER_ALREADY_SETTLED =
      "invalid_deferred_evm_payload_voucher_already_settled";
  public static final String VOUCHER_FLUSHED = "invalid_deferred_evm_payload_voucher_flushed";
  public static final String VOUCHER_SETTLEMENT_IN_PROGRESS =
      "invalid_deferred_evm_payload_voucher_settlement_in_progress";
  public static final String VOUCHER_COULD_NOT_SETTLE_STORE =
      "invalid_deferred_evm_payload_voucher_could_not_settle_store";
  public static final String VOUCHER_ERROR_SETTLING_STORE =
      "invalid_deferred_evm_payload_voucher_error_settling_store";

  // deferred: on-chain reads
  public static final String CONTRACT_CALL_FAILED_OUTSTANDING_AMOUNT =
      "invalid_deferred_evm_contract_call_failed_outstanding_amount";
  public static final String CONTRACT_CALL_FAILED_ACCOUNT =
      "invalid_deferred_evm_contract_call_failed_account";
  public static final String CONTRACT_CALL_FAILED_NONCES =
      "invalid_deferred_evm_contract_call_failed_nonces";
  public static final String CONTRACT_CALL_FAILED_DEPOSIT_NONCE_USED =
      "invalid_deferred_evm_contract_call_failed_is_deposit_authorization_nonce_used";
  public static final String CONTRACT_CALL_FAILED_ALLOWANCE =
      "invalid_deferred_evm_contract_call_failed_allowance";

  // deferred: deposit authorization
  public static final String PERMIT_SIGNATURE = "invalid_deferred_evm_payload_permit_signature";
  public static final String PERMIT_CONTINUITY = "invalid_deferred_evm_payload_permit_continuity";
  public static final String PERMIT_NONCE_INVALID =
      "invalid_deferred_evm_payload_permit_nonce_invalid";
  public static final String DEPOSIT_AUTHORIZATION_SIGNATURE =
      "invalid_deferred_evm_payload_deposit_authorization_signature";
  public static final String DEPOSIT_AUTHORIZATION_CONTINUITY =
      "invalid_deferred_evm_payload_deposit_authorization_continuity";
  public static final String DEPOSIT_AUTHORIZATION_BUYER_MISMATCH =
      "invalid_deferred_evm_payload_deposit_authorization_buyer_mismatch";
  public static final String DEPOSIT_AUTHORIZATION_NONCE_INVALID =
      "invalid_deferred_evm_payload_deposit_authorization_nonce_invalid";
  public static final String DEPOSIT_AUTHORIZATION_EXPIRED =
      "invalid_deferred_evm_payload_deposit_authorization_expired";
  public static final String DEPOSIT_AUTHORIZATION_INSUFFICIENT_ALLOWANCE =
      "invalid_deferred_evm_payload_deposit_authorization_insufficient_allowance";
  public static final String DEPOSIT_AUTHORIZATION_FAILED =
      "invalid_deferred_evm_payload_deposit_authorization_failed";

  // deferred: flush authorization
  public static final String FLUSH_AUTHORIZATION_MALFORMED =
      "invalid_deferred_evm_payload_flush_authorization_malformed";
  public static final String FLUSH_AUTHORIZATION_SIGNATURE =
      "invalid_deferred_evm_payload_flush_authorization_signature";
  public static final String FLUSH_AUTHORIZATION_EXPIRED =
      "invalid_deferred_evm_payload_flush_authorization_expired";
  public static final String FLUSH_AUTHORIZATION_NONCE_USED =
      "invalid_deferred_evm_payload_flush_authorization_nonce_used";
  public static final String FLUSH_AUTHORIZATION_BUYER_MISMATCH =
      "invalid_deferred_evm_payload_flush_authorization_buyer_mismatch";
  public static final String FLUSH_AUTHORIZATION_FAILED =
      "invalid_deferred_evm_payload_flush_authorization_failed";

  private ErrorReasons() {
  }
}
