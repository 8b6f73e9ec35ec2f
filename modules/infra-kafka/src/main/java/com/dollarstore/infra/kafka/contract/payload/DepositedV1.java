package com.dollarstore.infra.kafka.contract.payload;

import java.math.BigInteger;
import java.time.Instant;

public record DepositedV1(
    String account,
    String asset,
    BigInteger amount,
    BigInteger syntheticMinted,
    Instant occurredAt) {}
