package com.dollarstore.exchangeapi.reconciliation;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

/**
 * Drift is ledger minus custody, in canonical units. {@code supplyDrift} compares the ledger's
 * synthetic supply with the synthetic token's total supply.
 */
public record ReconciliationResult(
    Instant startedAt,
    Instant finishedAt,
    ReconciliationStatus status,
    Map<String, BigInteger> driftByAsset,
    BigInteger supplyDrift) {}
