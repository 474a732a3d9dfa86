package com.ryan.x402facilitator.model.deferred;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DeferredRequirementsExtraTest {

  private static final String ID = "0x" + "ab".repeat(32);
  private static final String ESCROW = "0x" + "44".repeat(20);

  @Test
  void newVoucherExtra_serializesWithTypeDiscriminator() {
    var extra = new NewVoucherExtra(ID, ESCROW, null);

    var map = extra.toMap();

    assertThat(map).containsEntry("type", "new");
    assertThat(map).doesNotContainKey("account");
    assertThat(DeferredRequirementsExtra.from(map)).isInstanceOfSatisfying(NewVoucherExtra.class,
        decoded -> {
          assertThat(decoded.kind()).isEqualTo(DeferredRequirementsExtra.Kind.NEW);
          assertThat(decoded.voucher.id).isEqualTo(ID);
          assertThat(decoded.voucher.escrow).isEqualTo(ESCROW);
        });
  }

  @Test
  void aggregationExtra_carriesPreviousVoucherAndSignature() {
    var previous = new SignedVoucher();
    previous.id = ID;
    previous.buyer = "0x" + "11".repeat(20);
    previous.seller = "0x" + "22".repeat(20);
    previous.valueAggregate = "500";
    previous.asset = "0x" + "33".repeat(20);
    previous.escrow = ESCROW;
    previous.nonce = 3;
    previous.signature = "0xbeef";
    var account = new EscrowAccountDetails("100", "0", "1");

    var map = new AggregationExtra(previous, account).toMap();
    var decoded = DeferredRequirementsExtra.from(map);

    assertThat(decoded.kind()).isEqualTo(DeferredRequirementsExtra.Kind.AGGREGATION);
    assertThat(decoded.account().balance).isEqualTo("100");
    var aggregation = (AggregationExtra) decoded;
    assertThat(aggregation.signature).isEqualTo("0xbeef");
    assertThat(aggregation.previousVoucher().nonce).isEqualTo(3);
    assertThat(aggregation.previousVoucher().signature).isEqualTo("0xbeef");
  }

  @Test
  void from_unknownType_throwsIllegalArgument() {
    assertThatThrownBy(() -> DeferredRequirementsExtra.from(Map.of("type", "refund")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void from_emptyExtra_throwsIllegalArgument() {
    assertThatThrownBy(() -> DeferredRequirementsExtra.from(Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
