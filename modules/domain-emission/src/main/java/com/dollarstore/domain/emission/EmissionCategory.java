package com.dollarstore.domain.emission;

public enum EmissionCategory {
  MAKER,
  TAKER,
  FOUNDER
}
