package com.dollarstore.domain.common;

import java.math.BigInteger;

public final class Amounts {
  private Amounts() {}

  public static BigInteger requirePositive(BigInteger value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new ZeroAmountException(fieldName);
    }
    return value;
  }

  public static BigInteger requireNonNegative(BigInteger value, String fieldName) {
    if (value == null || value.signum() < 0) {
      throw new IllegalArgumentException(fieldName + " must be >= 0");
    }
    return value;
  }

  public static String requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
    return value;
  }

  public static BigInteger min(BigInteger left, BigInteger right) {
    return left.compareTo(right) <= 0 ? left : right;
  }
}
