package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;

public class AlreadyUnstakingException extends ExchangeDomainException {
  public AlreadyUnstakingException(String owner) {
    super(ErrorCode.ALREADY_UNSTAKING, "Stake of " + owner + " is already unstaking");
  }
}
