package com.ryan.x402facilitator.client;

import static com.ryan.x402facilitator.testutil.WebFixtures.ASSET;
import static com.ryan.x402facilitator.testutil.WebFixtures.BUYER;
import static com.ryan.x402facilitator.testutil.WebFixtures.CHAIN_ID;
import static com.ryan.x402facilitator.testutil.WebFixtures.ESCROW;
import static com.ryan.x402facilitator.testutil.WebFixtures.SELLER;
import static com.ryan.x402facilitator.testutil.WebFixtures.SERIES_ID;
import static com.ryan.x402facilitator.testutil.WebFixtures.deferredPayment;
import static com.ryan.x402facilitator.testutil.WebFixtures.voucher;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentRequirements;
import com.ryan.x402facilitator.util.Json;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpFacilitatorClientTest {

  private final Map<String, String> requestBodies = new ConcurrentHashMap<>();
  private final Map<String, String> requestQueries = new ConcurrentHashMap<>();
  private HttpServer server;
  private HttpFacilitatorClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
    client = new HttpFacilitatorClient("http://127.0.0.1:" + server.getAddress().getPort() + "/");
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void verify_postsPaymentRequestAndReadsResponse() throws Exception {
    respond("/verify", 200, "{\"isValid\":false,\"invalidReason\":\"insufficient_funds\"}");
    var requirements = new PaymentRequirements();
    requirements.scheme = "deferred";
    requirements.payTo = SELLER;

    var result = client.verify(deferredPayment(voucher(0, 100)), requirements);

    assertThat(result.isValid).isFalse();
    assertThat(result.invalidReason).isEqualTo(ErrorReasons.INSUFFICIENT_FUNDS);
    var sent = Json.MAPPER.readTree(requestBodies.get("/verify"));
    assertThat(sent.at("/paymentRequirements/payTo").asText()).isEqualTo(SELLER);
    assertThat(sent.at("/paymentPayload/payload/voucher/id").asText()).isEqualTo(SERIES_ID);
  }

  @Test
  void settle_errorStatus_throwsIOException() {
    respond("/settle", 503, "{\"error\":\"down\"}");

    var payload = deferredPayment(voucher(0, 100));
    var requirements = new PaymentRequirements();

    assertThatThrownBy(() -> client.settle(payload, requirements))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("503");
  }

  @Test
  void getAvailableVoucher_notFound_isEmpty() throws Exception {
    respond("/deferred/vouchers/available/", 404, "");

    assertThat(client.getAvailableVoucher(BUYER, SELLER)).isEmpty();
  }

  @Test
  void getAvailableVoucher_found_readsVoucher() throws Exception {
    respond(
        "/deferred/vouchers/available/", 200, Json.MAPPER.writeValueAsString(voucher(3, 700)));

    var available = client.getAvailableVoucher(BUYER, SELLER);

    assertThat(available).hasValueSatisfying(v -> assertThat(v.nonce).isEqualTo(3));
  }

  @Test
  void storeVoucher_rejected_returnsReasonFromBody() throws Exception {
    respond(
        "/deferred/vouchers",
        400,
        "{\"error\":\"" + ErrorReasons.VOUCHER_NONCE_MISMATCH + "\"}");

    var result = client.storeVoucher(voucher(5, 100));

    assertThat(result.success()).isFalse();
    assertThat(result.error()).isEqualTo(ErrorReasons.VOUCHER_NONCE_MISMATCH);
  }

  @Test
  void storeVoucher_created_isSuccess() throws Exception {
    respond("/deferred/vouchers", 201, Json.MAPPER.writeValueAsString(voucher(0, 100)));

    assertThat(client.storeVoucher(voucher(0, 100)).success()).isTrue();
  }

  @Test
  void lookupAccountDetails_sendsQueryAndReadsDetails() throws Exception {
    respond("/deferred/buyers/", 200, "{\"balance\":\"900\"}");

    var details = client.lookupAccountDetails(BUYER, SELLER, ASSET, ESCROW, CHAIN_ID);

    assertThat(details).hasValueSatisfying(d -> assertThat(d.balance).isEqualTo("900"));
    assertThat(requestQueries.get("/deferred/buyers/"))
        .contains("seller=" + SELLER)
        .contains("chainId=" + CHAIN_ID);
  }

  private void respond(String path, int status, String body) {
    server.createContext(
        path,
        exchange -> {
          requestBodies.put(path, read(exchange));
          var query = exchange.getRequestURI().getQuery();
          requestQueries.put(path, query == null ? "" : query);
          byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
          if (bytes.length > 0) {
            exchange.getResponseBody().write(bytes);
          }
          exchange.close();
        });
  }

  private static String read(HttpExchange exchange) throws IOException {
    return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
  }
}
