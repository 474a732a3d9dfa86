package com.ryan.x402facilitator.chain;

import com.ryan.x402facilitator.network.Network;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed per-network connections, assembled at startup.
 */
public class StaticChainConnections implements ChainConnections {

  private final Map<Network, ChainClient> clients = new EnumMap<>(Network.class);
  private final Map<Network, ChainSigner> signers = new EnumMap<>(Network.class);

  public StaticChainConnections withClient(Network network, ChainClient client) {
    clients.put(network, client);
    return this;
  }

  public StaticChainConnections withSigner(Network network, ChainSigner signer) {
    signers.put(network, signer);
    return this;
  }

  @Override
  public Optional<ChainClient> client(Network network) {
    ChainClient client = clients.get(network);
    if (client != null) {
      return Optional.of(client);
    }
    return Optional.ofNullable(signers.get(network));
  }

  @Override
  public Optional<ChainSigner> signer(Network network) {
    return Optional.ofNullable(signers.get(network));
  }
}
