package com.dollarstore.exchangeapi.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

public record SyntheticSwapRequest(
    @NotBlank String toAsset, @NotNull BigInteger amount, boolean queueIfUnavailable) {}
