package com.dollarstore.domain.common;

public class InvalidTransitionException extends ExchangeDomainException {
  public InvalidTransitionException(String message) {
    super(ErrorCode.INVALID_TRANSITION, message);
  }
}
