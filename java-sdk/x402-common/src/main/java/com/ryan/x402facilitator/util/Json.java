package com.ryan.x402facilitator.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Shared Jackson mapper for every x402 wire type.
 */
public final class Json {

  public static final ObjectMapper MAPPER = new ObjectMapper()
      .setSerializationInclusion(JsonInclude.Include.NON_NULL)
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private Json() {
  }

  /**
   * Converts a wire object into a plain map, e.g. to place it into requirements extra.
   */
  public static Map<String, Object> toMap(Object value) {
    return MAPPER.convertValue(value, MAP_TYPE);
  }
}
