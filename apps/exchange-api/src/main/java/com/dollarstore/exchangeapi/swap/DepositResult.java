package com.dollarstore.exchangeapi.swap;

import com.dollarstore.domain.queue.QueueFill;
import java.math.BigInteger;
import java.util.List;

public record DepositResult(BigInteger minted, List<QueueFill> fills, BigInteger takerReward) {
  public DepositResult {
    fills = List.copyOf(fills);
  }
}
