package com.ryan.x402facilitator.configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.ryan.x402facilitator.chain.ChainConnections;
import com.ryan.x402facilitator.chain.SignatureVerifier;
import com.ryan.x402facilitator.chain.StaticChainConnections;
import com.ryan.x402facilitator.client.FacilitatorClient;
import com.ryan.x402facilitator.client.HttpFacilitatorClient;
import com.ryan.x402facilitator.client.LocalFacilitatorClient;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.network.NetworkRegistry;
import com.ryan.x402facilitator.service.FacilitatorService;
import com.ryan.x402facilitator.voucher.InMemoryVoucherStore;
import com.ryan.x402facilitator.voucher.VoucherStore;
import com.ryan.x402facilitator.web.FacilitatorController;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class X402AutoConfigurationTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  X402FacilitatorAutoConfiguration.class, X402InterceptorAutoConfiguration.class));

  private ApplicationContextRunner withChain() {
    return runner
        .withBean(ChainConnections.class, StaticChainConnections::new)
        .withBean(SignatureVerifier.class, () -> mock(SignatureVerifier.class));
  }

  @Test
  void facilitatorEnabled_withChain_wiresServiceAndEndpoints() {
    withChain()
        .withPropertyValues("x402.facilitator.enabled=true")
        .run(
            context -> {
              assertThat(context).hasSingleBean(FacilitatorService.class);
              assertThat(context).hasSingleBean(FacilitatorController.class);
              assertThat(context)
                  .getBean(VoucherStore.class)
                  .isInstanceOf(InMemoryVoucherStore.class);
            });
  }

  @Test
  void facilitatorEnabled_withoutChain_backsOff() {
    runner
        .withPropertyValues("x402.facilitator.enabled=true")
        .run(context -> assertThat(context).doesNotHaveBean(FacilitatorService.class));
  }

  @Test
  void facilitatorDisabled_byDefault() {
    withChain().run(context -> assertThat(context).doesNotHaveBean(FacilitatorService.class));
  }

  @Test
  void facilitatorNetworks_restrictRegistry() {
    withChain()
        .withPropertyValues(
            "x402.facilitator.enabled=true", "x402.facilitator.networks=base-sepolia,base")
        .run(
            context ->
                assertThat(context.getBean(NetworkRegistry.class).enabled())
                    .containsExactlyInAnyOrder(Network.BASE_SEPOLIA, Network.BASE));
  }

  @Test
  void customVoucherStore_replacesInMemoryStore() {
    var custom = new InMemoryVoucherStore();
    withChain()
        .withPropertyValues("x402.facilitator.enabled=true")
        .withBean(VoucherStore.class, () -> custom)
        .run(context -> assertThat(context.getBean(VoucherStore.class)).isSameAs(custom));
  }

  @Test
  void interceptor_withLocalFacilitator_usesInProcessClient() {
    withChain()
        .withPropertyValues("x402.enabled=true", "x402.facilitator.enabled=true")
        .run(
            context ->
                assertThat(context.getBean(FacilitatorClient.class))
                    .isInstanceOf(LocalFacilitatorClient.class));
  }

  @Test
  void interceptor_accountDetails_offByDefault() {
    withChain()
        .withPropertyValues("x402.enabled=true", "x402.facilitator.enabled=true")
        .run(
            context -> {
              var interceptor =
                  context.getBean(X402InterceptorAutoConfiguration.class).x402Interceptor();
              assertThat(context.getBean(X402Configuration.class).isIncludeAccountDetails())
                  .isFalse();
              assertThat(interceptor.includesAccountDetails()).isFalse();
            });
  }

  @Test
  void interceptor_includeAccountDetailsProperty_reachesResolver() {
    withChain()
        .withPropertyValues(
            "x402.enabled=true",
            "x402.facilitator.enabled=true",
            "x402.include-account-details=true")
        .run(
            context -> {
              var interceptor =
                  context.getBean(X402InterceptorAutoConfiguration.class).x402Interceptor();
              assertThat(context.getBean(X402Configuration.class).isIncludeAccountDetails())
                  .isTrue();
              assertThat(interceptor.includesAccountDetails()).isTrue();
            });
  }

  @Test
  void interceptor_withRemoteFacilitator_usesHttpClient() {
    runner
        .withPropertyValues(
            "x402.enabled=true", "x402.facilitator-base-url=https://facilitator.example.com")
        .run(
            context ->
                assertThat(context.getBean(FacilitatorClient.class))
                    .isInstanceOf(HttpFacilitatorClient.class));
  }

  @Test
  void interceptor_withoutAnyFacilitator_failsToStart() {
    runner
        .withPropertyValues("x402.enabled=true")
        .run(context -> assertThat(context).hasFailed());
  }
}
