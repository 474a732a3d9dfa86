package com.ryan.x402facilitator.model;

/**
 * JSON returned by POST /verify on the facilitator.
 */
public class VerificationResponse {

  /**
   * Whether the payment verification succeeded.
   */
  public boolean isValid;

  /**
   * Reason for verification failure (if isValid is false).
   */
  public String invalidReason;

  /**
   * Address of the payer, recovered from the payload when possible, even on failure.
   */
  public String payer;

  public VerificationResponse() {
  }

  private VerificationResponse(boolean isValid, String invalidReason, String payer) {
    this.isValid = isValid;
    this.invalidReason = invalidReason;
    this.payer = payer;
  }

  public static VerificationResponse valid(String payer) {
    return new VerificationResponse(true, null, payer);
  }

  public static VerificationResponse invalid(String reason, String payer) {
    return new VerificationResponse(false, reason, payer);
  }

  @Override
  public String toString() {
    return "VerificationResponse{isValid=" + isValid + ", invalidReason=" + invalidReason
        + ", payer=" + payer + "}";
  }
}
