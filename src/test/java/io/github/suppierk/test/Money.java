package io.github.suppierk.test;

import io.github.suppierk.modeling.domain.ValueObject;
import io.github.suppierk.modeling.validation.ValidationResult;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Money extends ValueObject<Money, Map<String, Object>> {
  public Money(Map<String, Object> value) {
    super(value);
  }

  public static Money of(String amount, String currency) {
    final Map<String, Object> value = new LinkedHashMap<>();
    value.put("amount", new BigDecimal(amount));
    value.put("currency", currency);
    return new Money(value);
  }

  public BigDecimal amount() {
    return (BigDecimal) value().get("amount");
  }

  public String currency() {
    return (String) value().get("currency");
  }

  @Override
  protected ValidationResult validate(Map<String, Object> value) {
    if (value == null) {
      return ValidationResult.invalid("Money must be defined");
    }

    if (!(value.get("amount") instanceof BigDecimal amount) || amount.signum() < 0) {
      return ValidationResult.invalid("Amount must not be negative");
    }

    return ValidationResult.of(
        value.get("currency") instanceof String currency && currency.length() == 3);
  }

  @Override
  protected Money newInstance(Map<String, Object> value) {
    return new Money(value);
  }
}
