package com.dollarstore.exchangeapi.persistence;

import com.dollarstore.domain.emission.EmissionState;
import java.math.BigInteger;

/** Minted amounts per category. Caps are configuration and are not persisted. */
public record EmissionTotals(
    BigInteger makerMinted, BigInteger takerMinted, BigInteger founderVested) {
  public static EmissionTotals of(EmissionState state) {
    return new EmissionTotals(state.makerMinted(), state.takerMinted(), state.founderVested());
  }
}
