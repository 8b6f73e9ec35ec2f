package com.dollarstore.domain.reserve;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;
import java.math.BigInteger;

public class InvalidPrecisionException extends ExchangeDomainException {
  public InvalidPrecisionException(String asset, int decimals, BigInteger canonicalAmount) {
    super(
        ErrorCode.INVALID_PRECISION,
        "Amount "
            + canonicalAmount
            + " is not representable in "
            + asset
            + " with "
            + decimals
            + " decimals");
  }
}
