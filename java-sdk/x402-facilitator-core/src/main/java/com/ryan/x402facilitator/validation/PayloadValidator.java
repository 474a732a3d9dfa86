package com.ryan.x402facilitator.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Comparator;
import java.util.Optional;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/**
 * Checks wire objects against their bean validation constraints. Messages are interpolated
 * without an expression language implementation.
 */
public class PayloadValidator {

  private final Validator validator;

  public PayloadValidator() {
    ValidatorFactory factory = Validation.byDefaultProvider()
        .configure()
        .messageInterpolator(new ParameterMessageInterpolator())
        .buildValidatorFactory();
    this.validator = factory.getValidator();
  }

  /**
   * First violation as {@code "path message"}, ordered by property path so the result is stable.
   */
  public Optional<String> firstViolation(Object value) {
    if (value == null) {
      return Optional.of("value is missing");
    }
    return validator.validate(value).stream()
        .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
        .findFirst()
        .map(PayloadValidator::describe);
  }

  public boolean isValid(Object value) {
    return firstViolation(value).isEmpty();
  }

  private static String describe(ConstraintViolation<?> violation) {
    return violation.getPropertyPath() + " " + violation.getMessage();
  }
}
