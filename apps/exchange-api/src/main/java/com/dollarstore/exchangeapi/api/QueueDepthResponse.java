package com.dollarstore.exchangeapi.api;

import java.math.BigInteger;

public record QueueDepthResponse(String asset, BigInteger depth) {}
