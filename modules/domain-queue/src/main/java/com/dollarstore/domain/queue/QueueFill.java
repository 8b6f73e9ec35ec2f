package com.dollarstore.domain.queue;

import java.math.BigInteger;
import java.time.Instant;

public record QueueFill(
    long positionId,
    String owner,
    String asset,
    BigInteger filledAmount,
    BigInteger remainingAmount,
    QueueStatus statusAfter,
    Instant enqueuedAt) {}
