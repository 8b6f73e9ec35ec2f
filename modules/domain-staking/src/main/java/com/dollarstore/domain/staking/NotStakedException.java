package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;

public class NotStakedException extends ExchangeDomainException {
  public NotStakedException(String owner) {
    super(ErrorCode.NOT_STAKED, "Account " + owner + " has no active stake");
  }
}
