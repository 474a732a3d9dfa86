package com.ryan.x402facilitator.model;

import com.ryan.x402facilitator.util.Json;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * The payer's signed artifact, carried base64 encoded in the X-PAYMENT header. The inner
 * {@link #payload} is scheme specific, see {@link #payloadAs(Class)}.
 */
public class PaymentPayload {

  public int x402Version = 1;
  public String scheme;
  public String network;
  public Map<String, Object> payload;

  /**
   * Decodes an X-PAYMENT header value.
   *
   * @throws IllegalArgumentException if the header is not base64 encoded JSON of a payload
   */
  public static PaymentPayload fromHeader(String header) {
    if (header == null || header.isBlank()) {
      throw new IllegalArgumentException("payment header is empty");
    }
    try {
      byte[] json = Base64.getDecoder().decode(header.trim());
      PaymentPayload decoded = Json.MAPPER.readValue(json, PaymentPayload.class);
      if (decoded == null || decoded.payload == null) {
        throw new IllegalArgumentException("payment header carries no payload");
      }
      return decoded;
    } catch (IllegalArgumentException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new IllegalArgumentException("payment header is not valid JSON", ex);
    }
  }

  public String toHeader() {
    try {
      byte[] json = Json.MAPPER.writeValueAsBytes(this);
      return Base64.getEncoder().encodeToString(json);
    } catch (Exception ex) {
      throw new IllegalStateException("cannot encode payment payload", ex);
    }
  }

  /**
   * Reads the inner payload as the given scheme type.
   *
   * @throws IllegalArgumentException if the payload does not map onto the type
   */
  public <T> T payloadAs(Class<T> type) {
    if (payload == null) {
      throw new IllegalArgumentException("payment payload is missing");
    }
    return Json.MAPPER.convertValue(payload, type);
  }

  public static PaymentPayload of(String scheme, String network, Object schemePayload) {
    PaymentPayload pp = new PaymentPayload();
    pp.scheme = scheme;
    pp.network = network;
    pp.payload = Json.toMap(schemePayload);
    return pp;
  }
}
