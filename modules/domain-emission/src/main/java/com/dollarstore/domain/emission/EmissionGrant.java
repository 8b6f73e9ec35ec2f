package com.dollarstore.domain.emission;

import java.math.BigInteger;

public record EmissionGrant(
    EmissionCategory category, String recipient, BigInteger requested, BigInteger granted) {
  public boolean isClipped() {
    return granted.compareTo(requested) < 0;
  }
}
