package com.dollarstore.domain.common;

import java.util.Objects;

public class ExchangeDomainException extends RuntimeException {
  private final ErrorCode code;

  public ExchangeDomainException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code must not be null");
  }

  public ErrorCode code() {
    return code;
  }
}
