package com.ryan.x402facilitator.scheme.exact;

import static com.ryan.x402facilitator.testutil.TestVouchers.ASSET;
import static com.ryan.x402facilitator.testutil.TestVouchers.BUYER;
import static com.ryan.x402facilitator.testutil.TestVouchers.BUYER_SIGNATURE;
import static com.ryan.x402facilitator.testutil.TestVouchers.CLOCK;
import static com.ryan.x402facilitator.testutil.TestVouchers.FORGED_SIGNATURE;
import static com.ryan.x402facilitator.testutil.TestVouchers.NOW;
import static com.ryan.x402facilitator.testutil.TestVouchers.SELLER;
import static com.ryan.x402facilitator.testutil.TestVouchers.STRANGER;
import static com.ryan.x402facilitator.testutil.TestVouchers.hex32;
import static org.assertj.core.api.Assertions.assertThat;

import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.exact.ExactEvmPayload;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.testutil.FakeChain;
import com.ryan.x402facilitator.testutil.FixedSignatureVerifier;
import java.math.BigInteger;
import java.util.HashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExactEvmSchemeTest {

  private final ExactEvmScheme scheme = new ExactEvmScheme(new FixedSignatureVerifier(), CLOCK);

  private FakeChain chain;
  private ExactEvmPayload exact;
  private PaymentRequirements requirements;

  @BeforeEach
  void setUp() {
    chain = new FakeChain();
    exact = new ExactEvmPayload();
    exact.signature = BUYER_SIGNATURE;
    exact.authorization = new ExactEvmPayload.Authorization();
    exact.authorization.from = BUYER;
    exact.authorization.to = SELLER;
    exact.authorization.value = "1000";
    exact.authorization.validAfter = Long.toString(NOW - 10);
    exact.authorization.validBefore = Long.toString(NOW + 60);
    exact.authorization.nonce = hex32(42);

    requirements = new PaymentRequirements();
    requirements.scheme = "exact";
    requirements.network = "base-sepolia";
    requirements.maxAmountRequired = "1000";
    requirements.asset = ASSET;
    requirements.payTo = SELLER;
    requirements.extra = new HashMap<>();
    requirements.extra.put("name", "USDC");
    requirements.extra.put("version", "2");
  }

  @Test
  void verify_wellFormedAuthorization_isValid() {
    assertThat(verify().isValid).isTrue();
  }

  @Test
  void verify_forgedSignature_isRejected() {
    exact.signature = FORGED_SIGNATURE;

    assertThat(verify().invalidReason).isEqualTo(ErrorReasons.EXACT_EVM_SIGNATURE);
  }

  @Test
  void verify_payingSomeoneElse_isRecipientMismatch() {
    exact.authorization.to = STRANGER;

    assertThat(verify().invalidReason).isEqualTo(ErrorReasons.EXACT_EVM_RECIPIENT_MISMATCH);
  }

  @Test
  void verify_validBeforeInsideMargin_isRejected() {
    exact.authorization.validBefore = Long.toString(NOW + 6);

    assertThat(verify().invalidReason).isEqualTo(ErrorReasons.EXACT_EVM_VALID_BEFORE);
  }

  @Test
  void verify_notYetValid_isRejected() {
    exact.authorization.validAfter = Long.toString(NOW + 1);

    assertThat(verify().invalidReason).isEqualTo(ErrorReasons.EXACT_EVM_VALID_AFTER);
  }

  @Test
  void verify_balanceBelowValue_isInsufficientFunds() {
    chain.assetBalance = BigInteger.valueOf(999);

    assertThat(verify().invalidReason).isEqualTo(ErrorReasons.INSUFFICIENT_FUNDS);
  }

  @Test
  void verify_valueBelowPrice_isRejected() {
    exact.authorization.value = "999";

    assertThat(verify().invalidReason).isEqualTo(ErrorReasons.EXACT_EVM_VALUE);
  }

  @Test
  void verify_missingAssetDomain_isInvalidRequirements() {
    requirements.extra.remove("version");

    assertThat(verify().invalidReason).isEqualTo(ErrorReasons.INVALID_PAYMENT_REQUIREMENTS);
  }

  @Test
  void settle_submitsTransferWithAuthorization() {
    var result = scheme.settle(chain, payment(), exact, requirements, Network.BASE_SEPOLIA);

    assertThat(result.success).isTrue();
    assertThat(result.network).isEqualTo("base-sepolia");
    assertThat(result.transaction).isEqualTo(hex32(1));
    assertThat(chain.submittedCount(ExactEvmScheme.TRANSFER_WITH_AUTHORIZATION)).isEqualTo(1);
  }

  @Test
  void settle_failedReceipt_reportsTransaction() {
    chain.receiptsFail = true;

    var result = scheme.settle(chain, payment(), exact, requirements, Network.BASE_SEPOLIA);

    assertThat(result.success).isFalse();
    assertThat(result.errorReason).isEqualTo(ErrorReasons.INVALID_TRANSACTION_STATE);
    assertThat(result.transaction).isEqualTo(hex32(1));
    assertThat(result.payer).isEqualTo(BUYER);
  }

  private VerificationResponse verify() {
    return scheme.verify(chain, payment(), exact, requirements, Network.BASE_SEPOLIA);
  }

  private PaymentPayload payment() {
    return PaymentPayload.of("exact", "base-sepolia", exact);
  }
}
