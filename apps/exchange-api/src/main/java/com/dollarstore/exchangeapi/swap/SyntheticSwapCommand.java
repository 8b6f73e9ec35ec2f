package com.dollarstore.exchangeapi.swap;

import java.math.BigInteger;

/** Redeems synthetic tokens already held; {@code amount} is in canonical units. */
public record SyntheticSwapCommand(
    String owner, String toAsset, BigInteger amount, boolean queueIfUnavailable) {}
