package com.dollarstore.exchangeapi.swap;

import java.math.BigInteger;

public record WithdrawResult(BigInteger burned, BigInteger received) {}
