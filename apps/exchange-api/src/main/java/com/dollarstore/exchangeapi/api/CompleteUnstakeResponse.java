package com.dollarstore.exchangeapi.api;

import java.math.BigInteger;

public record CompleteUnstakeResponse(String account, BigInteger released) {}
