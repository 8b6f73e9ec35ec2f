package com.dollarstore.exchangeapi.token;

import com.dollarstore.domain.reserve.Asset;
import com.dollarstore.domain.reserve.UnsupportedAssetException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Token ledgers by symbol: one per reserve asset plus the synthetic and reward tokens. */
public final class TokenRegistry {
  private final Map<String, TokenLedger> tokens = new LinkedHashMap<>();
  private final TokenLedger synthetic;
  private final TokenLedger reward;

  public TokenRegistry(
      TokenLedger synthetic, TokenLedger reward, Collection<? extends TokenLedger> assetTokens) {
    this.synthetic = register(synthetic);
    this.reward = register(reward);
    for (TokenLedger token : assetTokens) {
      register(token);
    }
  }

  public TokenLedger require(String symbol) {
    TokenLedger token = tokens.get(Asset.normalizeSymbol(symbol));
    if (token == null) {
      throw new UnsupportedAssetException(symbol);
    }
    return token;
  }

  public TokenLedger synthetic() {
    return synthetic;
  }

  public TokenLedger reward() {
    return reward;
  }

  public List<TokenLedger> all() {
    return List.copyOf(tokens.values());
  }

  private TokenLedger register(TokenLedger token) {
    String key = Asset.normalizeSymbol(token.symbol());
    if (tokens.putIfAbsent(key, token) != null) {
      throw new IllegalArgumentException("Duplicate token symbol: " + key);
    }
    return token;
  }
}
