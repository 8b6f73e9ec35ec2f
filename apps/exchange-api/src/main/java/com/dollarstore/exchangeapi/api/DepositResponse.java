package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.swap.DepositResult;
import java.math.BigInteger;
import java.util.List;

public record DepositResponse(
    String asset, BigInteger minted, List<FillResponse> fills, BigInteger takerReward) {

  public static DepositResponse from(String asset, DepositResult result) {
    return new DepositResponse(
        asset,
        result.minted(),
        result.fills().stream().map(FillResponse::from).toList(),
        result.takerReward());
  }
}
