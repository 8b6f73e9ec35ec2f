package com.dollarstore.infra.kafka.contract.payload;

import java.math.BigInteger;
import java.time.Instant;

public record QueueFilledV1(
    long positionId,
    String owner,
    String asset,
    BigInteger filledAmount,
    BigInteger remainingAmount,
    String status,
    Instant occurredAt) {}
