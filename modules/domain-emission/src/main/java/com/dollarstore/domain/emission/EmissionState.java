package com.dollarstore.domain.emission;

import com.dollarstore.domain.common.Amounts;
import java.math.BigInteger;

public record EmissionState(
    BigInteger makerCap,
    BigInteger makerMinted,
    BigInteger takerCap,
    BigInteger takerMinted,
    BigInteger founderCap,
    BigInteger founderVested) {
  public EmissionState {
    requireWithinCap(makerMinted, makerCap, "maker");
    requireWithinCap(takerMinted, takerCap, "taker");
    requireWithinCap(founderVested, founderCap, "founder");
  }

  public static EmissionState withCaps(
      BigInteger makerCap, BigInteger takerCap, BigInteger founderCap) {
    return new EmissionState(
        makerCap, BigInteger.ZERO, takerCap, BigInteger.ZERO, founderCap, BigInteger.ZERO);
  }

  public BigInteger totalMinted() {
    return makerMinted.add(takerMinted).add(founderVested);
  }

  public BigInteger userMinted() {
    return makerMinted.add(takerMinted);
  }

  public BigInteger makerRemaining() {
    return makerCap.subtract(makerMinted);
  }

  public BigInteger takerRemaining() {
    return takerCap.subtract(takerMinted);
  }

  public BigInteger founderRemaining() {
    return founderCap.subtract(founderVested);
  }

  public BigInteger remaining(EmissionCategory category) {
    if (category == EmissionCategory.MAKER) {
      return makerRemaining();
    }
    if (category == EmissionCategory.TAKER) {
      return takerRemaining();
    }
    return founderRemaining();
  }

  EmissionState plus(EmissionCategory category, BigInteger amount) {
    if (category == EmissionCategory.MAKER) {
      return new EmissionState(
          makerCap, makerMinted.add(amount), takerCap, takerMinted, founderCap, founderVested);
    }
    if (category == EmissionCategory.TAKER) {
      return new EmissionState(
          makerCap, makerMinted, takerCap, takerMinted.add(amount), founderCap, founderVested);
    }
    return new EmissionState(
        makerCap, makerMinted, takerCap, takerMinted, founderCap, founderVested.add(amount));
  }

  private static void requireWithinCap(BigInteger minted, BigInteger cap, String category) {
    Amounts.requireNonNegative(cap, category + "Cap");
    Amounts.requireNonNegative(minted, category + "Minted");
    if (minted.compareTo(cap) > 0) {
      throw new IllegalArgumentException(category + " emission exceeds cap");
    }
  }
}
