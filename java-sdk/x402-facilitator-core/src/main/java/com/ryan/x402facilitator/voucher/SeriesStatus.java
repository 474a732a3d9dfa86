package com.ryan.x402facilitator.voucher;

/**
 * State of a voucher series. {@link #SETTLED} and {@link #FLUSHED} are terminal.
 */
public enum SeriesStatus {
  MINTED,
  AGGREGATED,
  SETTLED,
  FLUSHED;

  public boolean isTerminal() {
    return this == SETTLED || this == FLUSHED;
  }
}
