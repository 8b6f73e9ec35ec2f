package com.dollarstore.exchangeapi.swap;

import java.math.BigInteger;

/**
 * {@code received} is in the target asset's native units. When part of the amount could not be
 * served, {@code positionId} names the queue position holding {@code queuedAmount}.
 */
public record SwapResult(BigInteger received, Long positionId, BigInteger queuedAmount) {
  public boolean isQueued() {
    return positionId != null;
  }
}
