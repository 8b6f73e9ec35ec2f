package com.dollarstore.exchangeapi.api;

import com.dollarstore.domain.queue.QueueFill;
import java.math.BigInteger;

public record FillResponse(
    long positionId,
    String owner,
    BigInteger filledAmount,
    BigInteger remainingAmount,
    String status) {

  public static FillResponse from(QueueFill fill) {
    return new FillResponse(
        fill.positionId(),
        fill.owner(),
        fill.filledAmount(),
        fill.remainingAmount(),
        fill.statusAfter().name());
  }
}
