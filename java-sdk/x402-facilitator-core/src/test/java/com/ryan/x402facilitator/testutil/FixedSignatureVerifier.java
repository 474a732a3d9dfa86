package com.ryan.x402facilitator.testutil;

import com.ryan.x402facilitator.chain.SignatureVerification;
import com.ryan.x402facilitator.chain.SignatureVerifier;
import com.ryan.x402facilitator.chain.TypedMessage;
import java.util.Map;

/** Recovers signers from a fixed signature table instead of doing ECDSA recovery. */
public class FixedSignatureVerifier implements SignatureVerifier {

  private final Map<String, String> signers =
      Map.of(
          TestVouchers.BUYER_SIGNATURE, TestVouchers.BUYER,
          TestVouchers.OTHER_BUYER_SIGNATURE, TestVouchers.OTHER_BUYER,
          TestVouchers.FORGED_SIGNATURE, TestVouchers.STRANGER);

  @Override
  public SignatureVerification verify(TypedMessage message, String signature) {
    String signer = signature == null ? null : signers.get(signature);
    if (signer == null) {
      return SignatureVerification.invalid();
    }
    return new SignatureVerification(true, signer);
  }
}
