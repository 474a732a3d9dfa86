package com.ryan.x402facilitator.chain;

import com.ryan.x402facilitator.network.Network;
import java.util.Optional;

/**
 * Resolves the chain collaborators configured for a network.
 */
public interface ChainConnections {

  /**
   * Read client; a configured signer also serves as client.
   */
  Optional<ChainClient> client(Network network);

  Optional<ChainSigner> signer(Network network);
}
