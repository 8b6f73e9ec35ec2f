package com.dollarstore.infra.kafka.contract.payload;

import java.math.BigInteger;
import java.time.Instant;

public record QueueCancelledV1(
    long positionId, String owner, String asset, BigInteger refundedAmount, Instant occurredAt) {}
