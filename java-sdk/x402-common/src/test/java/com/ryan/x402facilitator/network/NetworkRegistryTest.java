package com.ryan.x402facilitator.network;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class NetworkRegistryTest {

  private final NetworkRegistry registry = new NetworkRegistry();

  @Test
  void idFor_knownNetwork_returnsChainId() {
    assertThat(registry.idFor("base-sepolia")).contains(84532L);
    assertThat(registry.idFor("avalanche")).contains(43114L);
    assertThat(registry.idFor("solana-devnet")).contains(103L);
  }

  @Test
  void idFor_unknownNetwork_isEmpty() {
    assertThat(registry.idFor("ethereum-classic")).isEmpty();
    assertThat(registry.idFor(null)).isEmpty();
  }

  @Test
  void networkFor_roundTripsEveryKnownNetwork() {
    for (Network network : Network.values()) {
      assertThat(registry.networkFor(network.chainId())).contains(network);
      assertThat(registry.idFor(network.id())).contains(network.chainId());
    }
  }

  @Test
  void require_unknownChainId_throws() {
    assertThatThrownBy(() -> registry.require(1L))
        .isInstanceOf(UnsupportedNetworkException.class)
        .hasMessageContaining("1");
  }

  @Test
  void restrictedRegistry_doesNotResolveDisabledNetworks() {
    var restricted = NetworkRegistry.of(List.of("base-sepolia"));

    assertThat(restricted.idFor("base-sepolia")).contains(84532L);
    assertThat(restricted.idFor("base")).isEmpty();
    assertThat(restricted.networkFor(8453L)).isEmpty();
    assertThat(restricted.enabled()).containsExactly(Network.BASE_SEPOLIA);
  }

  @Test
  void of_unknownIdentifier_throws() {
    assertThatThrownBy(() -> NetworkRegistry.of(List.of("base", "mainnet")))
        .isInstanceOf(UnsupportedNetworkException.class)
        .hasMessageContaining("mainnet");
  }

  @Test
  void families_areAssigned() {
    assertThat(Network.BASE.family()).isEqualTo(NetworkFamily.EVM);
    assertThat(Network.SOLANA.family()).isEqualTo(NetworkFamily.SVM);
  }
}
