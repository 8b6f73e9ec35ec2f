package com.dollarstore.exchangeapi.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

/** Deposit or withdrawal of {@code amount} native units of {@code asset}. */
public record AssetAmountRequest(@NotBlank String asset, @NotNull BigInteger amount) {}
