package com.dollarstore.domain.queue;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;

public class PositionNotFoundException extends ExchangeDomainException {
  public PositionNotFoundException(long positionId) {
    super(ErrorCode.POSITION_NOT_FOUND, "Open queue position not found: " + positionId);
  }
}
