package com.ryan.x402facilitator.configuration;

import com.ryan.x402facilitator.service.FacilitatorService;
import com.ryan.x402facilitator.voucher.VoucherLifecycleManager;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "x402.facilitator")
public class X402FacilitatorProperties {

  /**
   * Whether to run the facilitator in this application and expose its REST endpoints
   */
  private boolean enabled = false;

  /**
   * Network identifiers to serve, e.g. base-sepolia. Empty means every known network.
   */
  private List<String> networks = new ArrayList<>();

  /**
   * Protocol version advertised by /supported
   */
  private int x402Version = FacilitatorService.DEFAULT_X402_VERSION;

  /**
   * Confirmations the chain signer waits for. Informational, applied by the signer
   * implementation.
   */
  private int settlementConfirmations = 1;

  /**
   * Page size used when a voucher query gives no limit
   */
  private int voucherPageLimit = VoucherLifecycleManager.DEFAULT_PAGE_LIMIT;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getNetworks() {
    return networks;
  }

  public void setNetworks(List<String> networks) {
    this.networks = networks;
  }

  public int getX402Version() {
    return x402Version;
  }

  public void setX402Version(int x402Version) {
    this.x402Version = x402Version;
  }

  public int getSettlementConfirmations() {
    return settlementConfirmations;
  }

  public void setSettlementConfirmations(int settlementConfirmations) {
    this.settlementConfirmations = settlementConfirmations;
  }

  public int getVoucherPageLimit() {
    return voucherPageLimit;
  }

  public void setVoucherPageLimit(int voucherPageLimit) {
    this.voucherPageLimit = voucherPageLimit;
  }
}
