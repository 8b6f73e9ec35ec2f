package com.dollarstore.domain.emission;

import com.dollarstore.domain.common.Amounts;
import java.math.BigInteger;

/**
 * Reward rates. Reward amounts are valued in dollars and converted to reward token base units
 * with {@code rewardUnitsPerDollar}; at $0.01 per token with 6 decimals that is 100 * 10^6.
 */
public record EmissionSchedule(
    int makerAprBps, int takerFeeBps, BigInteger rewardUnitsPerDollar, int founderShareDivisor) {
  public static final EmissionSchedule DEFAULT =
      new EmissionSchedule(800, 1, BigInteger.valueOf(100_000_000L), 4);

  public EmissionSchedule {
    if (makerAprBps < 0 || takerFeeBps < 0) {
      throw new IllegalArgumentException("reward rates must be >= 0");
    }
    Amounts.requirePositive(rewardUnitsPerDollar, "rewardUnitsPerDollar");
    if (founderShareDivisor < 1) {
      throw new IllegalArgumentException("founderShareDivisor must be >= 1");
    }
  }
}
