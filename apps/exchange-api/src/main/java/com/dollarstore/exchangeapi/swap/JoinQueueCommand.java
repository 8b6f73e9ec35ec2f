package com.dollarstore.exchangeapi.swap;

import java.math.BigInteger;

public record JoinQueueCommand(String owner, String asset, BigInteger amount) {}
