package com.ryan.x402facilitator.network;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Bidirectional mapping between network identifiers and chain ids over the configured network
 * set. Unknown or disabled networks are reported, never defaulted.
 */
public class NetworkRegistry {

  private final Set<Network> enabled;
  private final Map<Long, Network> byChainId = new ConcurrentHashMap<>();

  public NetworkRegistry() {
    this(EnumSet.allOf(Network.class));
  }

  public NetworkRegistry(Collection<Network> enabled) {
    this.enabled = enabled.isEmpty() ? EnumSet.noneOf(Network.class) : EnumSet.copyOf(enabled);
    this.enabled.forEach(n -> byChainId.put(n.chainId(), n));
  }

  /**
   * Builds a registry from wire identifiers.
   *
   * @throws UnsupportedNetworkException if an identifier is unknown
   */
  public static NetworkRegistry of(Collection<String> networkIds) {
    if (networkIds == null || networkIds.isEmpty()) {
      return new NetworkRegistry();
    }
    List<Network> networks = networkIds.stream()
        .map(id -> Network.fromId(id)
            .orElseThrow(() -> new UnsupportedNetworkException("unknown network: " + id)))
        .collect(Collectors.toList());
    return new NetworkRegistry(networks);
  }

  public Optional<Network> find(String network) {
    return Network.fromId(network).filter(enabled::contains);
  }

  public Optional<Long> idFor(String network) {
    return find(network).map(Network::chainId);
  }

  public Optional<Network> networkFor(long chainId) {
    return Optional.ofNullable(byChainId.get(chainId));
  }

  /**
   * @throws UnsupportedNetworkException if the network is unknown or not enabled
   */
  public Network require(String network) {
    return find(network)
        .orElseThrow(() -> new UnsupportedNetworkException("unsupported network: " + network));
  }

  /**
   * @throws UnsupportedNetworkException if no enabled network has this chain id
   */
  public Network require(long chainId) {
    return networkFor(chainId)
        .orElseThrow(() -> new UnsupportedNetworkException("unsupported chain id: " + chainId));
  }

  public boolean isEnabled(Network network) {
    return enabled.contains(network);
  }

  /**
   * Enabled networks in declaration order.
   */
  public Set<Network> enabled() {
    return Collections.unmodifiableSet(enabled);
  }
}
