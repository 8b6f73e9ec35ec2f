package com.dollarstore.exchangeapi.token;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;
import java.math.BigInteger;

public class InsufficientBalanceException extends ExchangeDomainException {
  private final String account;
  private final String token;
  private final BigInteger requested;
  private final BigInteger available;

  public InsufficientBalanceException(
      String account, String token, BigInteger requested, BigInteger available) {
    super(
        ErrorCode.INSUFFICIENT_BALANCE,
        String.format(
            "Insufficient %s balance for account=%s requested=%s available=%s",
            token, account, requested, available));
    this.account = account;
    this.token = token;
    this.requested = requested;
    this.available = available;
  }

  public String account() {
    return account;
  }

  public String token() {
    return token;
  }

  public BigInteger requested() {
    return requested;
  }

  public BigInteger available() {
    return available;
  }
}
