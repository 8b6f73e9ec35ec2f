package com.dollarstore.exchangeapi.query;

import java.math.BigInteger;
import java.util.List;

public record ReserveSummary(
    List<ReserveView> reserves,
    BigInteger totalReserves,
    BigInteger syntheticSupply,
    boolean fullyBacked) {}
