package com.dollarstore.exchangeapi.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

/** Faucet mint of {@code amount} base units to {@code account}. */
public record TokenAmountRequest(@NotBlank String account, @NotNull BigInteger amount) {}
