package com.dollarstore.exchangeapi.token;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.exchangeapi.config.ExchangeProperties;
import com.dollarstore.exchangeapi.engine.ExchangeEngine;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TokenService {
  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  private final ExchangeEngine engine;
  private final TokenRegistry tokenRegistry;
  private final String custodyAccount;

  public TokenService(
      ExchangeEngine engine, TokenRegistry tokenRegistry, ExchangeProperties properties) {
    this.engine = engine;
    this.tokenRegistry = tokenRegistry;
    this.custodyAccount = properties.getCustodyAccount();
  }

  public TokenBalance balance(String symbol, String account) {
    return engine.read(() -> snapshot(tokenRegistry.require(symbol), account));
  }

  /** Sets how much of {@code owner}'s balance the exchange may pull for deposits and stakes. */
  public TokenBalance approve(String symbol, String owner, BigInteger amount) {
    return engine.execute(
        "approve",
        events -> {
          TokenLedger token = tokenRegistry.require(symbol);
          token.approve(owner, custodyAccount, amount);
          return snapshot(token, owner);
        });
  }

  /** Simulation faucet. The synthetic token is only ever minted against reserves. */
  public TokenBalance mint(String symbol, String account, BigInteger amount) {
    return engine.execute(
        "faucet_mint",
        events -> {
          TokenLedger token = tokenRegistry.require(symbol);
          if (token == tokenRegistry.synthetic()) {
            throw new IllegalArgumentException(
                token.symbol() + " can only be minted by depositing reserve assets");
          }
          Amounts.requirePositive(amount, "amount");
          token.mint(account, amount);
          log.info("Faucet mint token={} account={} amount={}", token.symbol(), account, amount);
          return snapshot(token, account);
        });
  }

  private TokenBalance snapshot(TokenLedger token, String account) {
    return new TokenBalance(
        token.symbol(),
        token.decimals(),
        account,
        token.balanceOf(account),
        token.allowance(account, custodyAccount));
  }
}
