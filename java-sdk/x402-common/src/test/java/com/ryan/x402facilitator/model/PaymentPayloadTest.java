package com.ryan.x402facilitator.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ryan.x402facilitator.model.deferred.DeferredSchemePayload;
import com.ryan.x402facilitator.model.deferred.Voucher;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class PaymentPayloadTest {

  @Test
  void fromHeader_decodesDeferredPayload() {
    var voucher = new Voucher();
    voucher.id = "0x" + "ab".repeat(32);
    voucher.buyer = "0x" + "11".repeat(20);
    voucher.seller = "0x" + "22".repeat(20);
    voucher.valueAggregate = "1000";
    voucher.asset = "0x" + "33".repeat(20);
    voucher.escrow = "0x" + "44".repeat(20);
    voucher.chainId = 84532;
    var deferred = new DeferredSchemePayload();
    deferred.signature = "0xdead";
    deferred.voucher = voucher;

    var header = PaymentPayload.of("deferred", "base-sepolia", deferred).toHeader();
    var decoded = PaymentPayload.fromHeader(header);

    assertThat(decoded.scheme).isEqualTo("deferred");
    assertThat(decoded.network).isEqualTo("base-sepolia");
    var inner = decoded.payloadAs(DeferredSchemePayload.class);
    assertThat(inner.voucher.buyer).isEqualTo(voucher.buyer);
    assertThat(inner.voucher.valueAggregateAmount()).isEqualTo(BigInteger.valueOf(1000));
    assertThat(inner.depositAuthorization).isNull();
  }

  @Test
  void fromHeader_notBase64_throwsIllegalArgument() {
    assertThatThrownBy(() -> PaymentPayload.fromHeader("%%%"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromHeader_notJson_throwsIllegalArgument() {
    var header = Base64.getEncoder().encodeToString("hello".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> PaymentPayload.fromHeader(header))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("JSON");
  }

  @Test
  void fromHeader_blank_throwsIllegalArgument() {
    assertThatThrownBy(() -> PaymentPayload.fromHeader(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
