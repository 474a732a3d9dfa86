package com.ryan.x402facilitator.configuration;

import com.ryan.x402facilitator.chain.ChainConnections;
import com.ryan.x402facilitator.chain.SignatureVerifier;
import com.ryan.x402facilitator.escrow.EscrowSettlementController;
import com.ryan.x402facilitator.escrow.EscrowVerifier;
import com.ryan.x402facilitator.escrow.FlushNonceRegistry;
import com.ryan.x402facilitator.escrow.InMemoryFlushNonceRegistry;
import com.ryan.x402facilitator.network.NetworkRegistry;
import com.ryan.x402facilitator.scheme.SchemeNetworkDispatcher;
import com.ryan.x402facilitator.scheme.deferred.DeferredEvmScheme;
import com.ryan.x402facilitator.scheme.exact.ExactEvmScheme;
import com.ryan.x402facilitator.scheme.exact.ExactSvmScheme;
import com.ryan.x402facilitator.service.FacilitatorService;
import com.ryan.x402facilitator.validation.PayloadValidator;
import com.ryan.x402facilitator.voucher.InMemoryVoucherStore;
import com.ryan.x402facilitator.voucher.VoucherLifecycleManager;
import com.ryan.x402facilitator.voucher.VoucherStore;
import com.ryan.x402facilitator.voucher.VoucherVerifier;
import com.ryan.x402facilitator.web.FacilitatorController;
import com.ryan.x402facilitator.web.FacilitatorExceptionHandler;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Runs the facilitator inside the application. The chain side ({@link ChainConnections} and
 * {@link SignatureVerifier}) is supplied by the application; everything else defaults to the
 * in-memory implementations and can be replaced by declaring a bean of the same type.
 */
@Slf4j
@AutoConfiguration(before = X402InterceptorAutoConfiguration.class)
@EnableConfigurationProperties(X402FacilitatorProperties.class)
@ConditionalOnProperty(prefix = "x402.facilitator", name = "enabled", havingValue = "true")
@ConditionalOnBean({ChainConnections.class, SignatureVerifier.class})
public class X402FacilitatorAutoConfiguration {

  @ConditionalOnMissingBean
  @Bean
  public Clock x402Clock() {
    return Clock.systemUTC();
  }

  @ConditionalOnMissingBean
  @Bean
  public NetworkRegistry x402NetworkRegistry(X402FacilitatorProperties props) {
    NetworkRegistry registry = NetworkRegistry.of(props.getNetworks());
    log.info("x402 facilitator serving networks: {}", registry.enabled());
    return registry;
  }

  @ConditionalOnMissingBean
  @Bean
  public VoucherStore x402VoucherStore(Clock clock) {
    return new InMemoryVoucherStore(clock);
  }

  @ConditionalOnMissingBean
  @Bean
  public FlushNonceRegistry x402FlushNonceRegistry() {
    return new InMemoryFlushNonceRegistry();
  }

  @ConditionalOnMissingBean
  @Bean
  public PayloadValidator x402PayloadValidator() {
    return new PayloadValidator();
  }

  @Bean
  public VoucherVerifier x402VoucherVerifier(SignatureVerifier signatures,
      PayloadValidator validator) {
    return new VoucherVerifier(signatures, validator);
  }

  @Bean
  public EscrowVerifier x402EscrowVerifier(SignatureVerifier signatures, Clock clock) {
    return new EscrowVerifier(signatures, clock);
  }

  @Bean
  public EscrowSettlementController x402EscrowSettlementController(EscrowVerifier escrowVerifier,
      VoucherVerifier voucherVerifier, FlushNonceRegistry flushNonces, PayloadValidator validator,
      Clock clock) {
    return new EscrowSettlementController(escrowVerifier, voucherVerifier, flushNonces, validator,
        clock);
  }

  @Bean
  public SchemeNetworkDispatcher x402SchemeNetworkDispatcher(NetworkRegistry networks,
      PayloadValidator validator, SignatureVerifier signatures, VoucherVerifier voucherVerifier,
      EscrowVerifier escrowVerifier, EscrowSettlementController escrow, Clock clock) {
    return new SchemeNetworkDispatcher(networks, validator,
        new ExactEvmScheme(signatures, clock),
        new ExactSvmScheme(),
        new DeferredEvmScheme(voucherVerifier, escrowVerifier, escrow, validator, clock));
  }

  @Bean
  public VoucherLifecycleManager x402VoucherLifecycleManager(VoucherStore store,
      VoucherVerifier verifier, X402FacilitatorProperties props) {
    return new VoucherLifecycleManager(store, verifier, props.getVoucherPageLimit());
  }

  @Bean
  public FacilitatorService x402FacilitatorService(NetworkRegistry networks,
      ChainConnections connections, SchemeNetworkDispatcher dispatcher,
      VoucherLifecycleManager vouchers, EscrowSettlementController escrow,
      PayloadValidator validator, X402FacilitatorProperties props) {
    return new FacilitatorService(networks, connections, dispatcher, vouchers, escrow, validator,
        props.getX402Version());
  }

  @Bean
  public FacilitatorController x402FacilitatorController(FacilitatorService service) {
    return new FacilitatorController(service);
  }

  @Bean
  public FacilitatorExceptionHandler x402FacilitatorExceptionHandler() {
    return new FacilitatorExceptionHandler();
  }
}
