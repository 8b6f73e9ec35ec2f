package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;

public class NotUnstakingException extends ExchangeDomainException {
  public NotUnstakingException(String owner) {
    super(ErrorCode.NOT_UNSTAKING, "Stake of " + owner + " is not unstaking");
  }
}
