package com.dollarstore.exchangeapi.query;

import java.math.BigInteger;

public record EmissionStats(
    BigInteger makerCap,
    BigInteger makerMinted,
    BigInteger makerRemaining,
    BigInteger takerCap,
    BigInteger takerMinted,
    BigInteger takerRemaining,
    BigInteger founderCap,
    BigInteger founderVested,
    BigInteger founderRemaining,
    BigInteger totalMinted,
    int makerAprBps,
    int takerFeeBps) {}
