package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.swap.SwapResult;
import java.math.BigInteger;

public record SwapResponse(
    String toAsset, BigInteger received, boolean queued, Long positionId, BigInteger queuedAmount) {

  public static SwapResponse from(String toAsset, SwapResult result) {
    return new SwapResponse(
        toAsset, result.received(), result.isQueued(), result.positionId(), result.queuedAmount());
  }
}
