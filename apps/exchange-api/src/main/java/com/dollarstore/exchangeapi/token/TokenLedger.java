package com.dollarstore.exchangeapi.token;

import java.math.BigInteger;

/**
 * Fungible token primitive the exchange moves value through. Amounts are in the token's own base
 * units.
 */
public interface TokenLedger {
  String symbol();

  int decimals();

  BigInteger balanceOf(String account);

  BigInteger allowance(String owner, String spender);

  void approve(String owner, String spender, BigInteger amount);

  void transfer(String from, String to, BigInteger amount);

  /** Moves {@code amount} from {@code from} on behalf of {@code spender}, consuming allowance. */
  void transferFrom(String spender, String from, String to, BigInteger amount);

  void mint(String to, BigInteger amount);

  void burn(String from, BigInteger amount);

  BigInteger totalSupply();
}
