package com.dollarstore.exchangeapi.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

/** {@code amount} is in synthetic token base units. */
public record JoinQueueRequest(@NotBlank String asset, @NotNull BigInteger amount) {}
