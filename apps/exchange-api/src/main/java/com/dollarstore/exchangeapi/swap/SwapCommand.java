package com.dollarstore.exchangeapi.swap;

import java.math.BigInteger;

/** {@code amount} is in the native units of {@code fromAsset}. */
public record SwapCommand(
    String owner,
    String fromAsset,
    String toAsset,
    BigInteger amount,
    boolean queueIfUnavailable) {}
