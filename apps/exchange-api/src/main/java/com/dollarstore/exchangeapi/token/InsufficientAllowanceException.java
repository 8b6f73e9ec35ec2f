package com.dollarstore.exchangeapi.token;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;
import java.math.BigInteger;

public class InsufficientAllowanceException extends ExchangeDomainException {
  public InsufficientAllowanceException(
      String owner, String spender, String token, BigInteger requested, BigInteger allowance) {
    super(
        ErrorCode.INSUFFICIENT_ALLOWANCE,
        String.format(
            "Insufficient %s allowance owner=%s spender=%s requested=%s allowance=%s",
            token, owner, spender, requested, allowance));
  }
}
