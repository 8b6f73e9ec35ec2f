package com.dollarstore.domain.common;

public class ZeroAmountException extends ExchangeDomainException {
  public ZeroAmountException(String fieldName) {
    super(ErrorCode.ZERO_AMOUNT, fieldName + " must be > 0");
  }
}
