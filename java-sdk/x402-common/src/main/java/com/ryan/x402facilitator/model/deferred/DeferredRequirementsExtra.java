package com.ryan.x402facilitator.model.deferred;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryan.x402facilitator.util.Json;
import java.util.Map;

/**
 * The "extra" of deferred payment requirements: either mint a new voucher series or aggregate
 * onto an existing voucher. Serialized with a {@code type} discriminator of {@code "new"} or
 * {@code "aggregation"}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = NewVoucherExtra.class, name = "new"),
    @JsonSubTypes.Type(value = AggregationExtra.class, name = "aggregation")
})
public sealed interface DeferredRequirementsExtra permits NewVoucherExtra, AggregationExtra {

  enum Kind {
    NEW,
    AGGREGATION
  }

  Kind kind();

  EscrowAccountDetails account();

  /**
   * Decodes a requirements extra map.
   *
   * @throws IllegalArgumentException if the map is not a deferred extra
   */
  static DeferredRequirementsExtra from(Map<String, Object> extra) {
    if (extra == null || extra.isEmpty()) {
      throw new IllegalArgumentException("deferred requirements carry no extra");
    }
    DeferredRequirementsExtra decoded = Json.MAPPER.convertValue(extra,
        DeferredRequirementsExtra.class);
    if (decoded == null) {
      throw new IllegalArgumentException("deferred requirements extra is empty");
    }
    return decoded;
  }

  default Map<String, Object> toMap() {
    return Json.toMap(this);
  }
}
