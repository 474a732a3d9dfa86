package com.ryan.x402facilitator.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "x402")
public class X402Configuration {

  /**
   * Whether to enable X402 payment interception
   */
  private boolean enabled = false;

  /**
   * Default payee address, can be overridden by @X402Payment.payTo
   */
  private String defaultPayTo;

  /**
   * Network identifier, e.g. base-sepolia
   */
  private String network = "base-sepolia";

  /**
   * Token contract address
   */
  private String asset;

  /**
   * EIP-712 domain name of the token, used by exact EVM payments
   */
  private String assetName = "USDC";

  /**
   * EIP-712 domain version of the token
   */
  private String assetVersion = "2";

  /**
   * Maximum payment waiting time (seconds)
   */
  private int maxTimeoutSeconds = 30;

  /**
   * Facilitator base URL. e.g. https://facilitator.example.com. Not needed when the facilitator
   * runs in-process.
   */
  private String facilitatorBaseUrl;

  /**
   * Escrow contract backing deferred payments
   */
  private String escrow;

  /**
   * Attach the buyer's escrow account details to deferred payment requirements. Costs one
   * facilitator lookup per 402 response for a known buyer.
   */
  private boolean includeAccountDetails = false;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getDefaultPayTo() {
    return defaultPayTo;
  }

  public void setDefaultPayTo(String defaultPayTo) {
    this.defaultPayTo = defaultPayTo;
  }

  public String getNetwork() {
    return network;
  }

  public void setNetwork(String network) {
    this.network = network;
  }

  public String getAsset() {
    return asset;
  }

  public void setAsset(String asset) {
    this.asset = asset;
  }

  public String getAssetName() {
    return assetName;
  }

  public void setAssetName(String assetName) {
    this.assetName = assetName;
  }

  public String getAssetVersion() {
    return assetVersion;
  }

  public void setAssetVersion(String assetVersion) {
    this.assetVersion = assetVersion;
  }

  public int getMaxTimeoutSeconds() {
    return maxTimeoutSeconds;
  }

  public void setMaxTimeoutSeconds(int maxTimeoutSeconds) {
    this.maxTimeoutSeconds = maxTimeoutSeconds;
  }

  public String getFacilitatorBaseUrl() {
    return facilitatorBaseUrl;
  }

  public void setFacilitatorBaseUrl(String facilitatorBaseUrl) {
    this.facilitatorBaseUrl = facilitatorBaseUrl;
  }

  public String getEscrow() {
    return escrow;
  }

  public void setEscrow(String escrow) {
    this.escrow = escrow;
  }

  public boolean isIncludeAccountDetails() {
    return includeAccountDetails;
  }

  public void setIncludeAccountDetails(boolean includeAccountDetails) {
    this.includeAccountDetails = includeAccountDetails;
  }
}
