package com.ryan.x402facilitator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON returned by GET /supported on the facilitator.
 */
public class SupportedResponse {

  public List<Kind> kinds = new ArrayList<>();

  public static class Kind {

    public int x402Version;
    public String scheme;
    public String network;

    /**
     * Scheme/network specific details, e.g. the SVM fee payer.
     */
    public Map<String, Object> extra;

    public Kind() {
    }

    public Kind(int x402Version, String scheme, String network, Map<String, Object> extra) {
      this.x402Version = x402Version;
      this.scheme = scheme;
      this.network = network;
      this.extra = extra;
    }
  }
}
