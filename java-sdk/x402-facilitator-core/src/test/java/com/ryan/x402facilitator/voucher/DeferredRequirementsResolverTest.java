package com.ryan.x402facilitator.voucher;

import static com.ryan.x402facilitator.testutil.TestVouchers.ASSET;
import static com.ryan.x402facilitator.testutil.TestVouchers.BUYER;
import static com.ryan.x402facilitator.testutil.TestVouchers.CHAIN_ID;
import static com.ryan.x402facilitator.testutil.TestVouchers.ESCROW;
import static com.ryan.x402facilitator.testutil.TestVouchers.NETWORK;
import static com.ryan.x402facilitator.testutil.TestVouchers.OTHER_BUYER;
import static com.ryan.x402facilitator.testutil.TestVouchers.SELLER;
import static com.ryan.x402facilitator.testutil.TestVouchers.SERIES_ID;
import static com.ryan.x402facilitator.testutil.TestVouchers.signed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ryan.x402facilitator.model.PaymentPayload;
import com.ryan.x402facilitator.model.deferred.AggregationExtra;
import com.ryan.x402facilitator.model.deferred.DeferredSchemePayload;
import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.model.deferred.NewVoucherExtra;
import java.io.IOException;
import java.util.Base64;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeferredRequirementsResolverTest {

  @Mock private VoucherGateway gateway;

  private DeferredRequirementsResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new DeferredRequirementsResolver(gateway);
  }

  @Test
  void resolve_noHeaders_mintsWithoutLookup() {
    var extra = resolver.resolve(null, null, SELLER, ASSET, ESCROW, CHAIN_ID);

    assertThat(extra).isInstanceOf(NewVoucherExtra.class);
    assertThat(((NewVoucherExtra) extra).voucher.escrow).isEqualTo(ESCROW);
    verifyNoInteractions(gateway);
  }

  @Test
  void resolve_buyerWithoutAvailableVoucher_mints() throws IOException {
    when(gateway.getAvailableVoucher(BUYER, SELLER)).thenReturn(Optional.empty());

    var extra = resolver.resolve(null, BUYER, SELLER, ASSET, ESCROW, CHAIN_ID);

    assertThat(extra).isInstanceOf(NewVoucherExtra.class);
  }

  @Test
  void resolve_buyerWithAvailableVoucher_aggregates() throws IOException {
    var available = signed(SERIES_ID, 3, 700);
    when(gateway.getAvailableVoucher(BUYER, SELLER)).thenReturn(Optional.of(available));

    var extra = resolver.resolve(null, BUYER, SELLER, ASSET, ESCROW, CHAIN_ID);

    assertThat(extra).isInstanceOf(AggregationExtra.class);
    var aggregation = (AggregationExtra) extra;
    assertThat(aggregation.voucher.id).isEqualTo(SERIES_ID);
    assertThat(aggregation.voucher.nonce).isEqualTo(3L);
    assertThat(aggregation.voucher.valueAggregate).isEqualTo("700");
    assertThat(aggregation.signature).isEqualTo(available.signature);
  }

  @Test
  void resolve_availableVoucherOnOtherEscrow_mints() throws IOException {
    var available = signed(SERIES_ID, 0, 100);
    available.escrow = "0x" + "4".repeat(40);
    when(gateway.getAvailableVoucher(BUYER, SELLER)).thenReturn(Optional.of(available));

    assertThat(resolver.resolve(null, BUYER, SELLER, ASSET, ESCROW, CHAIN_ID))
        .isInstanceOf(NewVoucherExtra.class);
  }

  @Test
  void resolve_paymentHeaderBuyer_takesPrecedenceOverBuyerHeader() throws IOException {
    var payload = new DeferredSchemePayload();
    payload.voucher = signed(SERIES_ID, 0, 100).unsigned();
    payload.signature = signed(SERIES_ID, 0, 100).signature;
    String header = PaymentPayload.of("deferred", NETWORK, payload).toHeader();
    when(gateway.getAvailableVoucher(BUYER, SELLER)).thenReturn(Optional.empty());

    resolver.resolve(header, OTHER_BUYER, SELLER, ASSET, ESCROW, CHAIN_ID);

    verify(gateway).getAvailableVoucher(BUYER, SELLER);
  }

  @Test
  void resolve_undecodablePaymentHeader_mintsWithoutLookup() {
    String header = Base64.getEncoder().encodeToString("not json".getBytes());

    var extra = resolver.resolve(header, BUYER, SELLER, ASSET, ESCROW, CHAIN_ID);

    assertThat(extra).isInstanceOf(NewVoucherExtra.class);
    verifyNoInteractions(gateway);
  }

  @Test
  void resolve_gatewayFailure_mints() throws IOException {
    when(gateway.getAvailableVoucher(BUYER, SELLER)).thenThrow(new IOException("timeout"));

    assertThat(resolver.resolve(null, BUYER, SELLER, ASSET, ESCROW, CHAIN_ID))
        .isInstanceOf(NewVoucherExtra.class);
  }

  @Test
  void resolve_withAccountDetails_attachesThemAndSurvivesLookupFailure() throws IOException {
    var withAccounts = new DeferredRequirementsResolver(gateway, true);
    var details = new EscrowAccountDetails("900", "0", "1");
    when(gateway.getAvailableVoucher(BUYER, SELLER)).thenReturn(Optional.empty());
    when(gateway.lookupAccountDetails(any(), any(), any(), any(), anyLong()))
        .thenReturn(Optional.of(details))
        .thenThrow(new IOException("rpc down"));

    var first = withAccounts.resolve(null, BUYER, SELLER, ASSET, ESCROW, CHAIN_ID);
    var second = withAccounts.resolve(null, BUYER, SELLER, ASSET, ESCROW, CHAIN_ID);

    assertThat(first.account()).isSameAs(details);
    assertThat(second).isInstanceOf(NewVoucherExtra.class);
    assertThat(second.account()).isNull();
  }
}
