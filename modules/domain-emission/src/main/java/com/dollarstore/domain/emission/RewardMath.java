package com.dollarstore.domain.emission;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;

public final class RewardMath {
  private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);
  private static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(365L * 24 * 60 * 60);
  private static final BigInteger CANONICAL_UNIT = BigInteger.TEN.pow(18);

  private RewardMath() {}

  /**
   * APR accrued on a filled synthetic amount for the time it waited in the queue, in reward token
   * base units. Rounds down.
   */
  public static BigInteger makerReward(
      BigInteger filledCanonical, Duration waited, EmissionSchedule schedule) {
    if (filledCanonical.signum() <= 0 || waited.isNegative() || waited.isZero()) {
      return BigInteger.ZERO;
    }
    return filledCanonical
        .multiply(BigInteger.valueOf(schedule.makerAprBps()))
        .multiply(BigInteger.valueOf(waited.getSeconds()))
        .multiply(schedule.rewardUnitsPerDollar())
        .divide(BPS_DENOMINATOR.multiply(SECONDS_PER_YEAR).multiply(CANONICAL_UNIT));
  }

  /** The taker fee that would have applied on the cleared amount, in reward token base units. */
  public static BigInteger takerReward(BigInteger clearedCanonical, EmissionSchedule schedule) {
    if (clearedCanonical.signum() <= 0) {
      return BigInteger.ZERO;
    }
    return clearedCanonical
        .multiply(BigInteger.valueOf(schedule.takerFeeBps()))
        .multiply(schedule.rewardUnitsPerDollar())
        .divide(BPS_DENOMINATOR.multiply(CANONICAL_UNIT));
  }

  /**
   * Display score {@code (1 + power / sqrt(orderSize)) * secondsInQueue}. It never changes fill
   * order or reward amounts.
   */
  public static BigDecimal fillScore(BigInteger power, BigInteger orderSize, long secondsInQueue) {
    if (orderSize.signum() <= 0 || secondsInQueue <= 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal sqrtSize = new BigDecimal(orderSize).sqrt(MathContext.DECIMAL64);
    BigDecimal boost = new BigDecimal(power).divide(sqrtSize, MathContext.DECIMAL64);
    return BigDecimal.ONE
        .add(boost)
        .multiply(BigDecimal.valueOf(secondsInQueue))
        .setScale(6, RoundingMode.HALF_UP);
  }
}
