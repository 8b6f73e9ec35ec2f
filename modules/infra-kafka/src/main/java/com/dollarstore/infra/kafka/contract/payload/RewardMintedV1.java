package com.dollarstore.infra.kafka.contract.payload;

import java.math.BigInteger;
import java.time.Instant;

public record RewardMintedV1(
    String account,
    String category,
    BigInteger requested,
    BigInteger amount,
    Instant occurredAt) {}
