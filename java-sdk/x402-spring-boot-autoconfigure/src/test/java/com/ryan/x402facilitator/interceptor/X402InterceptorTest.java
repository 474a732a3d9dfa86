package com.ryan.x402facilitator.interceptor;

import static com.ryan.x402facilitator.testutil.WebFixtures.ASSET;
import static com.ryan.x402facilitator.testutil.WebFixtures.BUYER;
import static com.ryan.x402facilitator.testutil.WebFixtures.CHAIN_ID;
import static com.ryan.x402facilitator.testutil.WebFixtures.ESCROW;
import static com.ryan.x402facilitator.testutil.WebFixtures.NETWORK;
import static com.ryan.x402facilitator.testutil.WebFixtures.SELLER;
import static com.ryan.x402facilitator.testutil.WebFixtures.SERIES_ID;
import static com.ryan.x402facilitator.testutil.WebFixtures.TX_HASH;
import static com.ryan.x402facilitator.testutil.WebFixtures.deferredPayment;
import static com.ryan.x402facilitator.testutil.WebFixtures.exactPayment;
import static com.ryan.x402facilitator.testutil.WebFixtures.voucher;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ryan.x402facilitator.annotation.X402Payment;
import com.ryan.x402facilitator.client.FacilitatorClient;
import com.ryan.x402facilitator.configuration.X402Configuration;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentRequiredResponse;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.SettlementResponseHeader;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.util.Json;
import com.ryan.x402facilitator.voucher.VoucherGateway;
import com.ryan.x402facilitator.voucher.VoucherStoreResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

@ExtendWith(MockitoExtension.class)
class X402InterceptorTest {

  @Mock private FacilitatorClient facilitator;
  @Mock private VoucherGateway vouchers;

  private X402Interceptor interceptor;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;

  @BeforeEach
  void setUp() {
    var config = new X402Configuration();
    config.setEnabled(true);
    config.setDefaultPayTo(SELLER);
    config.setNetwork(NETWORK);
    config.setAsset(ASSET);
    config.setEscrow(ESCROW);
    interceptor = new X402Interceptor(config, facilitator, vouchers);
    request = new MockHttpServletRequest("GET", "/weather");
    response = new MockHttpServletResponse();
  }

  @Test
  void preHandle_unannotatedHandler_passesThrough() throws Exception {
    assertThat(interceptor.preHandle(request, response, handler("free"))).isTrue();
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Test
  void preHandle_exactWithoutHeader_responds402WithRequirements() throws Exception {
    assertThat(interceptor.preHandle(request, response, handler("exact"))).isFalse();

    var body = paymentRequired();
    assertThat(response.getStatus()).isEqualTo(402);
    assertThat(body.error).isEqualTo("X-PAYMENT header is required");
    var requirements = body.accepts.get(0);
    assertThat(requirements.scheme).isEqualTo("exact");
    assertThat(requirements.maxAmountRequired).isEqualTo("10000");
    assertThat(requirements.payTo).isEqualTo(SELLER);
    assertThat(requirements.resource).isEqualTo("http://localhost/weather");
    assertThat(requirements.extra).containsEntry("name", "USDC").containsEntry("version", "2");
  }

  @Test
  void preHandle_malformedHeader_responds402() throws Exception {
    request.addHeader("X-PAYMENT", "not-base64!");

    assertThat(interceptor.preHandle(request, response, handler("exact"))).isFalse();

    assertThat(response.getStatus()).isEqualTo(402);
    assertThat(paymentRequired().error).isEqualTo("malformed X-PAYMENT header");
  }

  @Test
  void preHandle_rejectedPayment_responds402WithReasonAndPayer() throws Exception {
    request.addHeader("X-PAYMENT", exactPayment().toHeader());
    when(facilitator.verify(any(), any()))
        .thenReturn(VerificationResponse.invalid(ErrorReasons.INSUFFICIENT_FUNDS, BUYER));

    assertThat(interceptor.preHandle(request, response, handler("exact"))).isFalse();

    var body = paymentRequired();
    assertThat(body.error).isEqualTo(ErrorReasons.INSUFFICIENT_FUNDS);
    assertThat(body.payer).isEqualTo(BUYER);
  }

  @Test
  void preHandle_facilitatorUnreachable_responds500() throws Exception {
    request.addHeader("X-PAYMENT", exactPayment().toHeader());
    when(facilitator.verify(any(), any())).thenThrow(new IOException("connection refused"));

    assertThat(interceptor.preHandle(request, response, handler("exact"))).isFalse();

    assertThat(response.getStatus()).isEqualTo(500);
    assertThat(response.getContentAsString()).contains("connection refused");
  }

  @Test
  void afterCompletion_verifiedExactPayment_settlesAndSetsResponseHeader() throws Exception {
    request.addHeader("X-PAYMENT", exactPayment().toHeader());
    when(facilitator.verify(any(), any())).thenReturn(VerificationResponse.valid(BUYER));
    when(facilitator.settle(any(), any()))
        .thenReturn(SettlementResponse.success(TX_HASH, NETWORK, BUYER));
    var handler = handler("exact");

    assertThat(interceptor.preHandle(request, response, handler)).isTrue();
    interceptor.afterCompletion(request, response, handler, null);

    var header = response.getHeader("X-PAYMENT-RESPONSE");
    assertThat(header).isNotNull();
    var decoded =
        Json.MAPPER.readValue(
            new String(Base64.getDecoder().decode(header), StandardCharsets.UTF_8),
            SettlementResponseHeader.class);
    assertThat(decoded.success).isTrue();
    assertThat(decoded.transaction).isEqualTo(TX_HASH);
    assertThat(decoded.network).isEqualTo(NETWORK);
    assertThat(decoded.payer).isEqualTo(BUYER);
  }

  @Test
  void afterCompletion_handlerFailed_skipsSettlement() throws Exception {
    request.addHeader("X-PAYMENT", exactPayment().toHeader());
    when(facilitator.verify(any(), any())).thenReturn(VerificationResponse.valid(BUYER));
    var handler = handler("exact");

    interceptor.preHandle(request, response, handler);
    response.setStatus(500);
    interceptor.afterCompletion(request, response, handler, null);

    verify(facilitator, never()).settle(any(), any());
  }

  @Test
  void preHandle_deferredWithoutBuyer_offersNewVoucherOnConfiguredEscrow() throws Exception {
    assertThat(interceptor.preHandle(request, response, handler("deferred"))).isFalse();

    var requirements = paymentRequired().accepts.get(0);
    assertThat(requirements.scheme).isEqualTo("deferred");
    assertThat(requirements.maxAmountRequired).isEqualTo("1000");
    assertThat(requirements.extra).containsEntry("type", "new");
    @SuppressWarnings("unchecked")
    var reference = (Map<String, Object>) requirements.extra.get("voucher");
    assertThat(reference).containsEntry("escrow", ESCROW);
    assertThat((String) reference.get("id")).matches("0x[0-9a-f]{64}");
  }

  @Test
  void preHandle_deferredKnownBuyerWithAvailableVoucher_offersAggregation() throws Exception {
    request.addHeader("X-BUYER", BUYER);
    when(vouchers.getAvailableVoucher(BUYER, SELLER)).thenReturn(Optional.of(voucher(2, 3000)));

    interceptor.preHandle(request, response, handler("deferred"));

    var requirements = paymentRequired().accepts.get(0);
    assertThat(requirements.extra).containsEntry("type", "aggregation");
    @SuppressWarnings("unchecked")
    var previous = (Map<String, Object>) requirements.extra.get("voucher");
    assertThat(previous).containsEntry("id", SERIES_ID).containsEntry("nonce", 2);
  }

  @Test
  void preHandle_deferredWithAccountDetailsEnabled_attachesBuyerAccount() throws Exception {
    var config = new X402Configuration();
    config.setDefaultPayTo(SELLER);
    config.setNetwork(NETWORK);
    config.setAsset(ASSET);
    config.setEscrow(ESCROW);
    config.setIncludeAccountDetails(true);
    interceptor = new X402Interceptor(config, facilitator, vouchers);
    request.addHeader("X-BUYER", BUYER);
    when(vouchers.getAvailableVoucher(BUYER, SELLER)).thenReturn(Optional.empty());
    when(vouchers.lookupAccountDetails(BUYER, SELLER, ASSET, ESCROW, CHAIN_ID))
        .thenReturn(Optional.of(new EscrowAccountDetails("5000", "0", "0")));

    interceptor.preHandle(request, response, handler("deferred"));

    var requirements = paymentRequired().accepts.get(0);
    assertThat(requirements.extra).containsEntry("type", "new");
    @SuppressWarnings("unchecked")
    var account = (Map<String, Object>) requirements.extra.get("account");
    assertThat(account).containsEntry("balance", "5000");
  }

  @Test
  void preHandle_verifiedDeferredPayment_storesVoucherAndNeverSettles() throws Exception {
    request.addHeader("X-PAYMENT", deferredPayment(voucher(0, 1000)).toHeader());
    when(facilitator.verify(any(), any())).thenReturn(VerificationResponse.valid(BUYER));
    when(vouchers.storeVoucher(any())).thenReturn(VoucherStoreResult.ok());
    var handler = handler("deferred");

    assertThat(interceptor.preHandle(request, response, handler)).isTrue();
    interceptor.afterCompletion(request, response, handler, null);

    verify(vouchers).storeVoucher(argThat(v -> SERIES_ID.equals(v.id) && v.nonce == 0));
    verify(facilitator, never()).settle(any(), any());
    assertThat(response.getHeader("X-PAYMENT-RESPONSE")).isNull();
  }

  @Test
  void preHandle_deferredVoucherRejectedByStore_responds402() throws Exception {
    request.addHeader("X-PAYMENT", deferredPayment(voucher(0, 1000)).toHeader());
    when(facilitator.verify(any(), any())).thenReturn(VerificationResponse.valid(BUYER));
    when(vouchers.storeVoucher(any()))
        .thenReturn(VoucherStoreResult.failure(ErrorReasons.VOUCHER_ALREADY_EXISTS));

    assertThat(interceptor.preHandle(request, response, handler("deferred"))).isFalse();

    assertThat(response.getStatus()).isEqualTo(402);
    assertThat(paymentRequired().error).isEqualTo(ErrorReasons.VOUCHER_ALREADY_EXISTS);
  }

  private PaymentRequiredResponse paymentRequired() throws Exception {
    return Json.MAPPER.readValue(response.getContentAsString(), PaymentRequiredResponse.class);
  }

  private static HandlerMethod handler(String method) throws NoSuchMethodException {
    return new HandlerMethod(new WeatherController(), WeatherController.class.getMethod(method));
  }

  static class WeatherController {

    @X402Payment(price = "0.01")
    public String exact() {
      return "sunny";
    }

    @X402Payment(price = "0.001", scheme = "deferred")
    public String deferred() {
      return "sunny";
    }

    public String free() {
      return "cloudy";
    }
  }
}
