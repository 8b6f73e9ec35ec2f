package com.dollarstore.exchangeapi.staking;

import com.dollarstore.domain.staking.StakeStatus;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

public record StakingInfo(
    String owner,
    StakeStatus status,
    BigInteger stakedAmount,
    BigInteger power,
    Instant stakeStartedAt,
    Instant unstakeInitiatedAt,
    Instant unstakeAvailableAt,
    Duration timeUntilFullPower,
    BigInteger dailyFeeFreeCap,
    BigInteger redeemedToday) {}
