package com.ryan.x402facilitator.web;

import com.ryan.x402facilitator.chain.ChainException;
import com.ryan.x402facilitator.model.ErrorReasons;
import com.ryan.x402facilitator.model.PaymentRequest;
import com.ryan.x402facilitator.model.SettlementResponse;
import com.ryan.x402facilitator.model.SupportedResponse;
import com.ryan.x402facilitator.model.VerificationResponse;
import com.ryan.x402facilitator.model.deferred.EscrowAccountDetails;
import com.ryan.x402facilitator.model.deferred.SignedVoucher;
import com.ryan.x402facilitator.model.deferred.VoucherCollection;
import com.ryan.x402facilitator.service.FacilitatorService;
import com.ryan.x402facilitator.voucher.VoucherStoreResult;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of an in-process facilitator: the x402 verify/settle/supported endpoints and the
 * deferred voucher and escrow operations.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class FacilitatorController {

  private final FacilitatorService service;

  @PostMapping("/verify")
  public VerificationResponse verify(@RequestBody PaymentRequest request) {
    return service.verify(request.paymentPayload, request.paymentRequirements);
  }

  @PostMapping("/settle")
  public SettlementResponse settle(@RequestBody PaymentRequest request) {
    return service.settle(request.paymentPayload, request.paymentRequirements);
  }

  @GetMapping("/supported")
  public SupportedResponse supported() {
    return service.supported();
  }

  @GetMapping("/deferred/vouchers/{id}")
  public List<SignedVoucher> getVoucherSeries(@PathVariable String id,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Integer offset) {
    return service.getVoucherSeries(id, limit, offset);
  }

  @GetMapping("/deferred/vouchers/{id}/{nonce}")
  public ResponseEntity<SignedVoucher> getVoucher(@PathVariable String id,
      @PathVariable long nonce) {
    return ResponseEntity.of(service.getVoucher(id, nonce));
  }

  @GetMapping("/deferred/vouchers/available/{buyer}/{seller}")
  public ResponseEntity<SignedVoucher> getAvailableVoucher(@PathVariable String buyer,
      @PathVariable String seller) {
    return ResponseEntity.of(service.getAvailableVoucher(buyer, seller));
  }

  @PostMapping("/deferred/vouchers")
  public ResponseEntity<Object> storeVoucher(@RequestBody SignedVoucher voucher) {
    VoucherStoreResult result = service.storeVoucher(voucher);
    if (!result.success()) {
      log.info("x402 voucher rejected id: {} nonce: {} reason: {}", voucher.id, voucher.nonce,
          result.error());
      return ResponseEntity.badRequest().body(Map.of("error", result.error()));
    }
    return ResponseEntity.status(HttpStatus.CREATED).body(voucher);
  }

  @PostMapping("/deferred/vouchers/{id}/{nonce}/settle")
  public ResponseEntity<SettlementResponse> settleVoucher(@PathVariable String id,
      @PathVariable long nonce) {
    SettlementResponse result = service.settleVoucher(id, nonce);
    if (!result.success && ErrorReasons.VOUCHER_NOT_FOUND.equals(result.errorReason)) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }
    return toResponse(result);
  }

  @GetMapping("/deferred/vouchers/{id}/{nonce}/collections")
  public List<VoucherCollection> getVoucherCollections(@PathVariable String id,
      @PathVariable long nonce, @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Integer offset) {
    return service.getVoucherCollections(id, nonce, limit, offset);
  }

  @PostMapping("/deferred/buyers/{buyer}/flush")
  public ResponseEntity<SettlementResponse> flush(@PathVariable String buyer,
      @RequestBody FlushRequest request) {
    return toResponse(service.flushEscrow(buyer, request.flushAuthorization, request.escrow,
        request.chainId));
  }

  @PostMapping("/deferred/deposits")
  public ResponseEntity<SettlementResponse> deposit(@RequestBody DepositRequest request) {
    return toResponse(service.depositWithAuthorization(request.voucher,
        request.depositAuthorization));
  }

  @GetMapping("/deferred/buyers/{buyer}/account")
  public ResponseEntity<EscrowAccountDetails> getAccountDetails(@PathVariable String buyer,
      @RequestParam String seller, @RequestParam String asset, @RequestParam String escrow,
      @RequestParam long chainId) throws ChainException {
    return ResponseEntity.of(service.getEscrowAccountDetails(buyer, seller, asset, escrow,
        chainId));
  }

  private static ResponseEntity<SettlementResponse> toResponse(SettlementResponse result) {
    return result.success ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
  }
}
