package com.dollarstore.exchangeapi.token;

import java.math.BigInteger;

/** {@code allowance} is what the exchange custody account may still pull from the account. */
public record TokenBalance(
    String symbol, int decimals, String account, BigInteger balance, BigInteger allowance) {}
