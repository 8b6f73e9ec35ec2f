package com.dollarstore.infra.kafka.contract.payload;

import java.math.BigInteger;
import java.time.Instant;

public record QueueJoinedV1(
    long positionId, String owner, String asset, BigInteger amount, Instant occurredAt) {}
