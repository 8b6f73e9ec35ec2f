package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.Amounts;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record StakeAccount(
    String owner,
    BigInteger stakedAmount,
    StakeStatus status,
    Instant stakeStartedAt,
    Instant unstakeInitiatedAt) {
  public StakeAccount {
    Amounts.requireNonBlank(owner, "owner");
    Amounts.requireNonNegative(stakedAmount, "stakedAmount");
    Objects.requireNonNull(status, "status must not be null");
    if (status != StakeStatus.NONE) {
      Objects.requireNonNull(stakeStartedAt, "stakeStartedAt must not be null");
    }
    if (status == StakeStatus.UNSTAKING) {
      Objects.requireNonNull(unstakeInitiatedAt, "unstakeInitiatedAt must not be null");
    }
  }

  public static StakeAccount none(String owner) {
    return new StakeAccount(owner, BigInteger.ZERO, StakeStatus.NONE, null, null);
  }

  /** Linear ramp from zero at stake start to the full balance after the full power duration. */
  public BigInteger power(Instant now, StakingPolicy policy) {
    if (status != StakeStatus.STAKED || stakedAmount.signum() == 0) {
      return BigInteger.ZERO;
    }
    long elapsedMillis = Duration.between(stakeStartedAt, now).toMillis();
    long fullMillis = policy.fullPowerDuration().toMillis();
    if (elapsedMillis <= 0) {
      return BigInteger.ZERO;
    }
    if (elapsedMillis >= fullMillis) {
      return stakedAmount;
    }
    return stakedAmount
        .multiply(BigInteger.valueOf(elapsedMillis))
        .divide(BigInteger.valueOf(fullMillis));
  }

  public Duration timeUntilFullPower(Instant now, StakingPolicy policy) {
    if (status != StakeStatus.STAKED) {
      return Duration.ZERO;
    }
    Duration remaining = Duration.between(now, stakeStartedAt.plus(policy.fullPowerDuration()));
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public Instant unstakeAvailableAt(StakingPolicy policy) {
    if (status != StakeStatus.UNSTAKING) {
      return null;
    }
    return unstakeInitiatedAt.plus(policy.unstakeCooldown());
  }
}
