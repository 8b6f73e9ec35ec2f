package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.Amounts;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Objects;

/** Synthetic amount {@code owner} redeemed during the UTC {@code day}. */
public record DailyRedemption(String owner, LocalDate day, BigInteger used) {
  public DailyRedemption {
    Amounts.requireNonBlank(owner, "owner");
    Objects.requireNonNull(day, "day must not be null");
    Amounts.requireNonNegative(used, "used");
  }
}
