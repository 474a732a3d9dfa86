package com.ryan.x402facilitator.web;

import com.ryan.x402facilitator.chain.ChainException;
import com.ryan.x402facilitator.voucher.VoucherStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps facilitator endpoint failures to {@code {"error": ...}} bodies.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = FacilitatorController.class)
public class FacilitatorExceptionHandler {

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.warn("x402 unreadable request body: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ErrorResponse("malformed request body"));
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class, IllegalArgumentException.class})
  public ResponseEntity<ErrorResponse> handleBadArgument(Exception ex) {
    log.warn("x402 bad request argument: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ErrorResponse(ex.getMessage()));
  }

  @ExceptionHandler(ChainException.class)
  public ResponseEntity<ErrorResponse> handleChainFailure(ChainException ex) {
    log.error("x402 chain read failed", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ErrorResponse("chain unavailable: " + ex.getMessage()));
  }

  @ExceptionHandler(VoucherStoreException.class)
  public ResponseEntity<ErrorResponse> handleStoreFailure(VoucherStoreException ex) {
    log.error("x402 voucher store failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("voucher store unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    log.error("x402 unexpected facilitator error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("An unexpected error occurred"));
  }

  public record ErrorResponse(String error) {
  }
}
