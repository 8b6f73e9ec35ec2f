package com.dollarstore.exchangeapi.api;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

/** An amount in the base units of the token the endpoint acts on. */
public record AmountRequest(@NotNull BigInteger amount) {}
