package com.ryan.x402facilitator.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler method (or every handler of a controller) as paid through x402.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface X402Payment {

  /**
   * "0.01" = 0.01 USDC, converted with 6 decimals
   */
  String price();

  String payTo() default "";

  /**
   * "exact" settles on each request, "deferred" collects a voucher and settles later.
   */
  String scheme() default "exact";
}
