package com.dollarstore.infra.kafka.contract.payload;

import java.math.BigInteger;
import java.time.Instant;

public record WithdrawnV1(
    String account,
    String asset,
    BigInteger amount,
    BigInteger syntheticBurned,
    String reason,
    Instant occurredAt) {}
