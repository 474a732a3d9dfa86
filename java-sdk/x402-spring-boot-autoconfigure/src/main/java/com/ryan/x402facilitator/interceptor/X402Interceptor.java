package com.ryan.x402facilitator.interceptor;

import static java.math.BigDecimal.TEN;
import static java.math.RoundingMode.DOWN;

import com.ryan.x402facilitator.annotation.X402Payment;
import com.ryan.x402facilitator.client.FacilitatorClient;
import com.ryan.x402facilitator.configuration.X402Configuration;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequiredResponse;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.SettlementResponseHeader;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.DeferredSchemePayload;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.network.Network;
import com.ryan.x402facilitator.scheme.PaymentScheme;
import com.ryan.x402facilitator.util.Json;
import com.ryan.x402facilitator.voucher.DeferredRequirementsResolver;
import com.ryan.x402facilitator.voucher.VoucherGateway;
import com.ryan.x402facilitator.voucher.VoucherStoreResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Guards {@link X402Payment} handlers. Exact payments are verified before the handler and settled
 * after it succeeds. Deferred payments are verified and their voucher stored before the handler;
 * they are collected later through the facilitator.
 */
@Slf4j
public class X402Interceptor implements HandlerInterceptor {

  public static final String PAYMENT_HEADER = "X-PAYMENT";
  public static final String BUYER_HEADER = "X-BUYER";
  public static final String PAYMENT_RESPONSE_HEADER = "X-PAYMENT-RESPONSE";

  private static final String ATTR_REQUIREMENTS = "x402.payment.requirements";
  private static final String ATTR_HEADER = "x402.payment.header";
  private static final String ATTR_PAYLOAD = "x402.payment.payload";
  private static final String ATTR_PAYER = "x402.payment.payer";

  private static final int X402_VERSION = 1;
  private static final int ASSET_DECIMALS = 6;

  private final X402Configuration config;
  private final FacilitatorClient facilitator;
  private final VoucherGateway vouchers;
  private final DeferredRequirementsResolver resolver;

  /**
   * @param vouchers voucher gateway for deferred payments, {@code null} when only exact payments
   *     are served
   */
  public X402Interceptor(X402Configuration config, FacilitatorClient facilitator,
      @Nullable VoucherGateway vouchers) {
    this.config = Objects.requireNonNull(config);
    this.facilitator = Objects.requireNonNull(facilitator);
    this.vouchers = vouchers;
    this.resolver = vouchers == null ? null
        : new DeferredRequirementsResolver(vouchers, config.isIncludeAccountDetails());
  }

  public boolean includesAccountDetails() {
    return resolver != null && resolver.includesAccountDetails();
  }

  /* ======================== preHandle: /verify ======================== */

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
      throws Exception {

    X402Payment annotation = resolveAnnotation(handler);
    // Non-payment endpoint, skip
    if (annotation == null) {
      return true;
    }

    PaymentScheme scheme = PaymentScheme.fromId(annotation.scheme())
        .orElseThrow(() -> new IllegalStateException(
            "@X402Payment.scheme not supported: " + annotation.scheme()));
    String url = request.getRequestURL().toString();
    String header = request.getHeader(PAYMENT_HEADER);
    PaymentRequirements requirements = buildRequirements(url, annotation, scheme, header,
        request.getHeader(BUYER_HEADER));

    if (!StringUtils.hasText(header)) {
      log.info("x402 called without payment header URL: {}", url);
      respond402(response, requirements, "X-PAYMENT header is required", null);
      return false;
    }

    PaymentPayload payload;
    VerificationResponse vr;

    try {
      payload = PaymentPayload.fromHeader(header);

      vr = facilitator.verify(payload, requirements);
    } catch (IllegalArgumentException ex) {
      log.info("x402 URL called with malformed payment URL: {} header: {}", url, header, ex);
      respond402(response, requirements, "malformed X-PAYMENT header", null);
      return false;
    } catch (IOException ex) {
      log.error("x402 URL communication error with facilitator URL: {} header: {}", url, header,
          ex);
      respond500(response, "Payment verification failed: " + ex.getMessage());
      return false;
    } catch (Exception ex) {
      log.error("x402 URL internal error URL: {} header: {}", url, header, ex);
      respond500(response, "Internal server error during payment verification");
      return false;
    }

    if (vr == null || !vr.isValid) {
      String reason = vr == null ? "verification failed" : vr.invalidReason;
      log.info("x402 payment verification failed URL: {} header: {} reason: {}", url, header,
          reason);
      respond402(response, requirements, reason, vr == null ? null : vr.payer);
      return false;
    }

    if (scheme == PaymentScheme.DEFERRED && !storeVoucher(response, requirements, payload, url)) {
      return false;
    }

    // verify passed, store for afterCompletion
    request.setAttribute(ATTR_REQUIREMENTS, requirements);
    request.setAttribute(ATTR_HEADER, header);
    request.setAttribute(ATTR_PAYLOAD, payload);
    if (vr.payer != null) {
      request.setAttribute(ATTR_PAYER, vr.payer);
    }

    return true;
  }

  /* ======================== afterCompletion: /settle ======================== */

  @Override
  public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
      Object handler, @Nullable Exception ex) throws Exception {
    X402Payment annotation = resolveAnnotation(handler);
    // Non-payment endpoint, skip
    if (annotation == null) {
      return;
    }

    PaymentRequirements requirements = (PaymentRequirements) request.getAttribute(
        ATTR_REQUIREMENTS);
    String header = (String) request.getAttribute(ATTR_HEADER);
    PaymentPayload payload = (PaymentPayload) request.getAttribute(ATTR_PAYLOAD);

    // Verification didn't pass, or deferred payment collected later
    if (requirements == null || header == null || payload == null
        || !PaymentScheme.EXACT.id().equals(requirements.scheme)) {
      return;
    }

    // If response already indicates an error, skip settlement
    if (response.getStatus() >= 400) {
      log.warn("x402 skipping settlement due to error response URL: {} status: {}",
          request.getRequestURL().toString(), response.getStatus());
      return;
    }

    try {
      SettlementResponse sr = facilitator.settle(payload, requirements);
      log.info("x402 settlement response URL: {} header: {} response: {}",
          request.getRequestURL().toString(), header, sr);
      if (sr == null || !sr.success) {
        String errorMsg = (sr != null && sr.errorReason != null) ? sr.errorReason
            : "settlement failed";
        log.error("x402 settlement failed URL: {} header: {} error: {}",
            request.getRequestURL().toString(), header, errorMsg);
        respond402(response, requirements, errorMsg, sr == null ? null : sr.payer);
        return;
      }

      try {
        String payer = sr.payer != null ? sr.payer : (String) request.getAttribute(ATTR_PAYER);
        response.setHeader(PAYMENT_RESPONSE_HEADER, createPaymentResponseHeader(sr, payer));
        response.setHeader("Access-Control-Expose-Headers", PAYMENT_RESPONSE_HEADER);
      } catch (Exception buildEx) {
        log.error("x402 settlement error creating response header URL: {} header: {}",
            request.getRequestURL().toString(), header, buildEx);
        respond500(response, "Failed to create settlement response header");
      }

    } catch (Exception e) {
      log.error("x402 settlement error URL: {} header: {}", request.getRequestURL().toString(),
          header, e);
      respond402(response, requirements, "settlement error: " + e.getMessage(), null);
    }
  }

  /* ======================== Resolve Annotation ======================== */

  @Nullable
  private X402Payment resolveAnnotation(Object handler) {
    if (!(handler instanceof HandlerMethod hm)) {
      return null;
    }

    X402Payment methodAnn = hm.getMethodAnnotation(X402Payment.class);
    if (methodAnn != null) {
      return methodAnn;
    }

    return hm.getBeanType().getAnnotation(X402Payment.class);
  }

  /* ======================== helpers ======================== */

  private PaymentRequirements buildRequirements(String url, X402Payment ann, PaymentScheme scheme,
      @Nullable String paymentHeader, @Nullable String buyerHeader) {
    String priceStr = ann.price();
    if (!StringUtils.hasText(priceStr)) {
      throw new IllegalStateException("@X402Payment.price must not be empty");
    }
    if (!StringUtils.hasText(config.getAsset())) {
      throw new IllegalStateException("x402.asset must be configured");
    }

    BigDecimal priceDecimal = new BigDecimal(priceStr).multiply(TEN.pow(ASSET_DECIMALS))
        .setScale(0, DOWN);

    String payTo = StringUtils.hasText(ann.payTo()) ? ann.payTo() : config.getDefaultPayTo();
    if (!StringUtils.hasText(payTo)) {
      throw new IllegalStateException("x402.default-pay-to or @X402Payment.payTo is required");
    }

    PaymentRequirements pr = new PaymentRequirements();
    pr.scheme = scheme.id();
    pr.network = config.getNetwork();
    pr.maxAmountRequired = priceDecimal.toPlainString();
    pr.asset = config.getAsset();
    pr.description = "";
    pr.resource = url;
    pr.mimeType = "application/json";
    pr.payTo = payTo;
    pr.maxTimeoutSeconds = config.getMaxTimeoutSeconds();
    pr.outputSchema = new HashMap<>();
    pr.extra = switch (scheme) {
      case EXACT -> {
        HashMap<String, Object> extra = new HashMap<>();
        extra.put("name", config.getAssetName());
        extra.put("version", config.getAssetVersion());
        yield extra;
      }
      case DEFERRED -> deferredExtra(payTo, paymentHeader, buyerHeader);
    };
    return pr;
  }

  private HashMap<String, Object> deferredExtra(String payTo, @Nullable String paymentHeader,
      @Nullable String buyerHeader) {
    if (resolver == null) {
      throw new IllegalStateException("deferred payments need a voucher gateway");
    }
    if (!StringUtils.hasText(config.getEscrow())) {
      throw new IllegalStateException("x402.escrow must be configured for deferred payments");
    }
    long chainId = Network.fromId(config.getNetwork())
        .map(Network::chainId)
        .orElseThrow(() -> new IllegalStateException("unknown network: " + config.getNetwork()));
    return new HashMap<>(resolver.resolve(paymentHeader, buyerHeader, payTo, config.getAsset(),
        config.getEscrow(), chainId).toMap());
  }

  // false when a response was written
  private boolean storeVoucher(HttpServletResponse response, PaymentRequirements requirements,
      PaymentPayload payload, String url) throws IOException {
    SignedVoucher voucher = payload.payloadAs(DeferredSchemePayload.class).signedVoucher();
    try {
      VoucherStoreResult stored = vouchers.storeVoucher(voucher);
      if (!stored.success()) {
        log.info("x402 voucher rejected by store URL: {} id: {} nonce: {} reason: {}", url,
            voucher.id, voucher.nonce, stored.error());
        respond402(response, requirements, stored.error(), voucher.buyer);
        return false;
      }
      log.info("x402 voucher stored URL: {} id: {} nonce: {}", url, voucher.id, voucher.nonce);
      return true;
    } catch (IOException ex) {
      log.error("x402 voucher store unreachable URL: {} id: {}", url, voucher.id, ex);
      respond500(response, "Voucher storage failed: " + ex.getMessage());
      return false;
    }
  }

  private void respond402(HttpServletResponse resp, PaymentRequirements requirements, String error,
      @Nullable String payer) throws IOException {

    if (resp.isCommitted()) {
      return;
    }

    resp.resetBuffer();
    resp.setStatus(HttpServletResponse.SC_PAYMENT_REQUIRED);
    resp.setContentType("application/json");

    PaymentRequiredResponse prr = new PaymentRequiredResponse();
    prr.x402Version = X402_VERSION;
    prr.accepts.add(requirements);
    prr.error = error;
    prr.payer = payer;

    resp.getWriter().write(Json.MAPPER.writeValueAsString(prr));
    resp.flushBuffer();
  }

  private void respond500(HttpServletResponse resp, String message) throws IOException {

    if (resp.isCommitted()) {
      return;
    }

    resp.resetBuffer();
    resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
    resp.setContentType("application/json");
    resp.getWriter().write(Json.MAPPER.writeValueAsString(Map.of("error", message)));
    resp.flushBuffer();
  }

  private String createPaymentResponseHeader(SettlementResponse sr, @Nullable String payer)
      throws IOException {
    SettlementResponseHeader settlementHeader = new SettlementResponseHeader(true,
        sr.transaction != null ? sr.transaction : "", sr.network != null ? sr.network : "",
        payer);

    String jsonString = Json.MAPPER.writeValueAsString(settlementHeader);
    return Base64.getEncoder().encodeToString(jsonString.getBytes(StandardCharsets.UTF_8));
  }
}
