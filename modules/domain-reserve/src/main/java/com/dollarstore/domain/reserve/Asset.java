package com.dollarstore.domain.reserve;

import java.math.BigInteger;
import java.util.Locale;

public record Asset(String symbol, int decimals, boolean supported) {
  public static final int CANONICAL_DECIMALS = 18;

  public Asset {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol must not be blank");
    }
    symbol = normalizeSymbol(symbol);
    if (decimals < 0 || decimals > CANONICAL_DECIMALS) {
      throw new IllegalArgumentException(
          "decimals must be between 0 and " + CANONICAL_DECIMALS + " for " + symbol);
    }
  }

  public BigInteger normalize(BigInteger nativeAmount) {
    return nativeAmount.multiply(scale());
  }

  public BigInteger denormalize(BigInteger canonicalAmount) {
    BigInteger[] quotientAndRemainder = canonicalAmount.divideAndRemainder(scale());
    if (quotientAndRemainder[1].signum() != 0) {
      throw new InvalidPrecisionException(symbol, decimals, canonicalAmount);
    }
    return quotientAndRemainder[0];
  }

  public boolean isRepresentable(BigInteger canonicalAmount) {
    return canonicalAmount.mod(scale()).signum() == 0;
  }

  private BigInteger scale() {
    return BigInteger.TEN.pow(CANONICAL_DECIMALS - decimals);
  }

  public static String normalizeSymbol(String symbol) {
    if (symbol == null) {
      return null;
    }
    return symbol.trim().toUpperCase(Locale.ROOT);
  }
}
