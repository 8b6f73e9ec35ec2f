package com.dollarstore.exchangeapi.api;

import java.math.BigInteger;

public record WithdrawResponse(String asset, BigInteger burned, BigInteger received) {}
