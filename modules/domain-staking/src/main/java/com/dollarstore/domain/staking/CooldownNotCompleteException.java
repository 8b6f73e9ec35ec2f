package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;
import java.time.Instant;

public class CooldownNotCompleteException extends ExchangeDomainException {
  private final Instant availableAt;

  public CooldownNotCompleteException(String owner, Instant availableAt) {
    super(
        ErrorCode.COOLDOWN_NOT_COMPLETE,
        "Unstake cooldown for " + owner + " completes at " + availableAt);
    this.availableAt = availableAt;
  }

  public Instant availableAt() {
    return availableAt;
  }
}
