package com.dollarstore.exchangeapi.swap;

import java.math.BigInteger;

/** {@code amount} is in the asset's native units. */
public record WithdrawCommand(String owner, String asset, BigInteger amount) {}
