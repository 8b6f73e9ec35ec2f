package com.dollarstore.domain.staking;

import java.time.Duration;
import java.util.Objects;

public record StakingPolicy(Duration fullPowerDuration, Duration unstakeCooldown) {
  public static final StakingPolicy DEFAULT =
      new StakingPolicy(Duration.ofDays(30), Duration.ofDays(7));

  public StakingPolicy {
    Objects.requireNonNull(fullPowerDuration, "fullPowerDuration must not be null");
    Objects.requireNonNull(unstakeCooldown, "unstakeCooldown must not be null");
    if (fullPowerDuration.isZero() || fullPowerDuration.isNegative()) {
      throw new IllegalArgumentException("fullPowerDuration must be > 0");
    }
    if (unstakeCooldown.isNegative()) {
      throw new IllegalArgumentException("unstakeCooldown must be >= 0");
    }
  }
}
