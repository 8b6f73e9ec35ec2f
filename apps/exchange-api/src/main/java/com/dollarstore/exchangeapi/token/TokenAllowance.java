package com.dollarstore.exchangeapi.token;

import com.dollarstore.domain.common.Amounts;
import java.math.BigInteger;

/** {@code spender} may pull up to {@code amount} base units from {@code owner}. */
public record TokenAllowance(String owner, String spender, BigInteger amount) {
  public TokenAllowance {
    Amounts.requireNonBlank(owner, "owner");
    Amounts.requireNonBlank(spender, "spender");
    Amounts.requireNonNegative(amount, "amount");
  }
}
