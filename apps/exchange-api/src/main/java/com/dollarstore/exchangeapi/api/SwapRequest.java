package com.dollarstore.exchangeapi.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

/** {@code amount} is in the native units of {@code fromAsset}. */
public record SwapRequest(
    @NotBlank String fromAsset,
    @NotBlank String toAsset,
    @NotNull BigInteger amount,
    boolean queueIfUnavailable) {}
