package com.dollarstore.domain.staking;

import java.math.BigInteger;

public class LinearFeeFreeCapPolicy implements FeeFreeCapPolicy {
  private static final int CANONICAL_DECIMALS = 18;
  private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

  private final BigInteger powerToCanonicalScale;
  private final BigInteger multiplierBps;

  public LinearFeeFreeCapPolicy(int rewardTokenDecimals, int multiplierBps) {
    if (rewardTokenDecimals < 0 || rewardTokenDecimals > CANONICAL_DECIMALS) {
      throw new IllegalArgumentException("rewardTokenDecimals must be between 0 and 18");
    }
    if (multiplierBps < 0) {
      throw new IllegalArgumentException("multiplierBps must be >= 0");
    }
    this.powerToCanonicalScale = BigInteger.TEN.pow(CANONICAL_DECIMALS - rewardTokenDecimals);
    this.multiplierBps = BigInteger.valueOf(multiplierBps);
  }

  @Override
  public BigInteger dailyCap(StakeAccount account, BigInteger power) {
    if (power.signum() <= 0) {
      return BigInteger.ZERO;
    }
    return power.multiply(powerToCanonicalScale).multiply(multiplierBps).divide(BPS_DENOMINATOR);
  }
}
