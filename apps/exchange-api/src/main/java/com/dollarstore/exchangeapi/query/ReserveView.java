package com.dollarstore.exchangeapi.query;

import java.math.BigInteger;

/**
 * {@code balance} and {@code queueDepth} are canonical; {@code nativeBalance} is in asset units.
 */
public record ReserveView(
    String asset,
    int decimals,
    boolean supported,
    BigInteger balance,
    BigInteger nativeBalance,
    BigInteger queueDepth) {}
