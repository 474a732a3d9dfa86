package com.ryan.x402facilitator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.PaymentRequest;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.SupportedResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.util.Json;
import com.ryan.x402facilitator.voucher.VoucherGateway;
import com.ryan.x402facilitator.voucher.VoucherStoreResult;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Talks to a remote facilitator over its REST surface. Also serves as the voucher gateway of a
 * resource server issuing deferred requirements.
 */
@Slf4j
public class HttpFacilitatorClient implements FacilitatorClient, VoucherGateway {

  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private final String baseUrl;
  private final HttpClient http;

  public HttpFacilitatorClient(String baseUrl) {
    this(baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
  }

  public HttpFacilitatorClient(String baseUrl, HttpClient http) {
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.http = http;
  }

  @Override
  public VerificationResponse verify(PaymentPayload payload, PaymentRequirements requirements)
      throws IOException {
    HttpResponse<String> response = post("/verify", new PaymentRequest(payload, requirements));
    requireOk(response, "/verify");
    return Json.MAPPER.readValue(response.body(), VerificationResponse.class);
  }

  @Override
  public SettlementResponse settle(PaymentPayload payload, PaymentRequirements requirements)
      throws IOException {
    HttpResponse<String> response = post("/settle", new PaymentRequest(payload, requirements));
    requireOk(response, "/settle");
    return Json.MAPPER.readValue(response.body(), SettlementResponse.class);
  }

  @Override
  public SupportedResponse supported() throws IOException {
    HttpResponse<String> response = get("/supported");
    requireOk(response, "/supported");
    return Json.MAPPER.readValue(response.body(), SupportedResponse.class);
  }

  @Override
  public Optional<SignedVoucher> getAvailableVoucher(String buyer, String seller)
      throws IOException {
    HttpResponse<String> response = get(
        "/deferred/vouchers/available/" + encode(buyer) + "/" + encode(seller));
    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    requireOk(response, "/deferred/vouchers/available");
    return Optional.of(Json.MAPPER.readValue(response.body(), SignedVoucher.class));
  }

  @Override
  public VoucherStoreResult storeVoucher(SignedVoucher voucher) throws IOException {
    HttpResponse<String> response = post("/deferred/vouchers", voucher);
    if (response.statusCode() == 400) {
      return VoucherStoreResult.failure(errorOf(response.body()));
    }
    requireOk(response, "/deferred/vouchers");
    return VoucherStoreResult.ok();
  }

  @Override
  public Optional<EscrowAccountDetails> lookupAccountDetails(String buyer, String seller,
      String asset, String escrow, long chainId) throws IOException {
    HttpResponse<String> response = get("/deferred/buyers/" + encode(buyer) + "/account"
        + "?seller=" + encode(seller)
        + "&asset=" + encode(asset)
        + "&escrow=" + encode(escrow)
        + "&chainId=" + chainId);
    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    requireOk(response, "/deferred/buyers/account");
    return Optional.of(Json.MAPPER.readValue(response.body(), EscrowAccountDetails.class));
  }

  private HttpResponse<String> post(String path, Object body) throws IOException {
    HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
        .timeout(TIMEOUT)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
        .build();
    return send(request);
  }

  private HttpResponse<String> get(String path) throws IOException {
    HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
        .timeout(TIMEOUT)
        .header("Accept", "application/json")
        .GET()
        .build();
    return send(request);
  }

  private HttpResponse<String> send(HttpRequest request) throws IOException {
    try {
      return http.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted calling facilitator " + request.uri(), ex);
    }
  }

  private static void requireOk(HttpResponse<String> response, String path) throws IOException {
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      log.warn("x402 facilitator error path: {} status: {} body: {}", path, status,
          response.body());
      throw new IOException("facilitator " + path + " returned HTTP " + status);
    }
  }

  private static String errorOf(String body) {
    try {
      JsonNode node = Json.MAPPER.readTree(body);
      return node.hasNonNull("error") ? node.get("error").asText() : body;
    } catch (IOException ex) {
      return body;
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }
}
