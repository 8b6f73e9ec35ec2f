package com.dollarstore.domain.reserve;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;
import java.math.BigInteger;

public class InsufficientReservesException extends ExchangeDomainException {
  private final String asset;
  private final BigInteger requested;
  private final BigInteger available;

  public InsufficientReservesException(String asset, BigInteger requested, BigInteger available) {
    super(
        ErrorCode.INSUFFICIENT_RESERVES,
        "Insufficient "
            + asset
            + " reserves: requested="
            + requested
            + " available="
            + available);
    this.asset = asset;
    this.requested = requested;
    this.available = available;
  }

  public String asset() {
    return asset;
  }

  public BigInteger requested() {
    return requested;
  }

  public BigInteger available() {
    return available;
  }
}
