package com.dollarstore.domain.queue;

import java.math.BigInteger;

public record QueuePositionInfo(BigInteger amountAhead, int positionNumber) {}
