package com.ryan.x402facilitator.network;

import java.util.Arrays;
import java.util.Optional;

/**
 * Networks the facilitator knows about. SVM chain ids are the conventional cluster numbers, they
 * only serve as registry keys.
 */
public enum Network {
  BASE_SEPOLIA("base-sepolia", 84532, NetworkFamily.EVM),
  BASE("base", 8453, NetworkFamily.EVM),
  AVALANCHE_FUJI("avalanche-fuji", 43113, NetworkFamily.EVM),
  AVALANCHE("avalanche", 43114, NetworkFamily.EVM),
  IOTEX("iotex", 4689, NetworkFamily.EVM),
  SEI("sei", 1329, NetworkFamily.EVM),
  SEI_TESTNET("sei-testnet", 1328, NetworkFamily.EVM),
  POLYGON("polygon", 137, NetworkFamily.EVM),
  POLYGON_AMOY("polygon-amoy", 80002, NetworkFamily.EVM),
  SOLANA_DEVNET("solana-devnet", 103, NetworkFamily.SVM),
  SOLANA("solana", 101, NetworkFamily.SVM);

  private final String id;
  private final long chainId;
  private final NetworkFamily family;

  Network(String id, long chainId, NetworkFamily family) {
    this.id = id;
    this.chainId = chainId;
    this.family = family;
  }

  /**
   * Wire identifier, e.g. {@code base-sepolia}.
   */
  public String id() {
    return id;
  }

  public long chainId() {
    return chainId;
  }

  public NetworkFamily family() {
    return family;
  }

  public static Optional<Network> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(n -> n.id.equals(id)).findFirst();
  }

  @Override
  public String toString() {
    return id;
  }
}
