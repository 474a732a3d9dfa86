package com.ryan.x402facilitator.configuration;

import com.ryan.x402facilitator.client.FacilitatorClient;
import com.ryan.x402facilitator.client.HttpFacilitatorClient;
import com.ryan.x402facilitator.client.LocalFacilitatorClient;
import com.ryan.x402facilitator.interceptor.X402Interceptor;
import com.ryan.x402facilitator.service.FacilitatorService;
import com.ryan.x402facilitator.voucher.VoucherGateway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@AutoConfiguration
@ConditionalOnClass(WebMvcConfigurer.class)
@EnableConfigurationProperties(X402Configuration.class)
@ConditionalOnProperty(prefix = "x402", name = "enabled", havingValue = "true")
public class X402InterceptorAutoConfiguration implements WebMvcConfigurer {

  private final X402Configuration properties;
  private final ObjectProvider<FacilitatorClient> facilitatorClient;
  private final ObjectProvider<VoucherGateway> voucherGateway;

  public X402InterceptorAutoConfiguration(X402Configuration properties,
      ObjectProvider<FacilitatorClient> facilitatorClient,
      ObjectProvider<VoucherGateway> voucherGateway) {
    this.properties = properties;
    this.facilitatorClient = facilitatorClient;
    this.voucherGateway = voucherGateway;
  }

  /**
   * The in-process facilitator when one is running, otherwise the remote one at
   * {@code x402.facilitator-base-url}.
   */
  @ConditionalOnMissingBean
  @Bean
  public FacilitatorClient x402FacilitatorClient(X402Configuration props,
      ObjectProvider<FacilitatorService> localService) {
    FacilitatorService service = localService.getIfAvailable();
    if (service != null) {
      return new LocalFacilitatorClient(service);
    }
    if (props.getFacilitatorBaseUrl() == null) {
      throw new IllegalStateException(
          "x402.facilitator-base-url must be configured when x402 is enabled");
    }
    return new HttpFacilitatorClient(props.getFacilitatorBaseUrl());
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(x402Interceptor());
  }

  X402Interceptor x402Interceptor() {
    return new X402Interceptor(properties, facilitatorClient.getObject(), resolveVoucherGateway());
  }

  // an explicit single gateway bean wins, then the local facilitator, then the HTTP client
  private VoucherGateway resolveVoucherGateway() {
    VoucherGateway gateway = voucherGateway.getIfUnique();
    if (gateway != null) {
      return gateway;
    }
    FacilitatorClient client = facilitatorClient.getObject();
    if (client instanceof HttpFacilitatorClient http) {
      return http;
    }
    return voucherGateway.orderedStream()
        .filter(FacilitatorService.class::isInstance)
        .findFirst()
        .orElse(null);
  }
}
