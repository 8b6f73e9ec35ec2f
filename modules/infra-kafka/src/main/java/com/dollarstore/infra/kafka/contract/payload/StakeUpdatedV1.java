package com.dollarstore.infra.kafka.contract.payload;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Stake account state after a staking transition. {@code amount} is the non-negative amount the
 * transition moved: staked, put into cooldown, released or re-staked. {@code unstakeAvailableAt} is
 * set only while the account is unstaking.
 */
public record StakeUpdatedV1(
    String account,
    String status,
    BigInteger stakedAmount,
    BigInteger amount,
    BigInteger power,
    Instant stakeStartedAt,
    Instant unstakeInitiatedAt,
    Instant unstakeAvailableAt,
    Instant occurredAt) {}
