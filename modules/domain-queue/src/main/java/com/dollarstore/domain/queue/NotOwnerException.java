package com.dollarstore.domain.queue;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;

public class NotOwnerException extends ExchangeDomainException {
  public NotOwnerException(long positionId, String caller) {
    super(ErrorCode.NOT_OWNER, "Account " + caller + " does not own queue position " + positionId);
  }
}
