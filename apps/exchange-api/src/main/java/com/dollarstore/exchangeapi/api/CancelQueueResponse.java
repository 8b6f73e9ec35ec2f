package com.dollarstore.exchangeapi.api;

import java.math.BigInteger;

public record CancelQueueResponse(long positionId, String status, BigInteger refunded) {}
