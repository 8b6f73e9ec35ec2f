package com.dollarstore.domain.reserve;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.common.ChangeSet;
import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.domain.common.UndoLog;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-asset reserve balances and the synthetic supply they back, all in canonical units. Every
 * credit mints and every debit burns the same amount of synthetic supply, so the sum of reserves
 * equals the supply whenever no transaction is in flight.
 */
public final class ReserveLedger implements TransactionalStore {
  private final AssetRegistry assetRegistry;
  private final Map<String, BigInteger> balances = new LinkedHashMap<>();
  private final UndoLog undoLog = new UndoLog();
  private final ChangeSet<String> changed = new ChangeSet<>();
  private BigInteger syntheticSupply = BigInteger.ZERO;

  public ReserveLedger(AssetRegistry assetRegistry) {
    this.assetRegistry = Objects.requireNonNull(assetRegistry, "assetRegistry must not be null");
  }

  public BigInteger credit(String symbol, BigInteger amount) {
    Asset asset = assetRegistry.require(symbol);
    Amounts.requirePositive(amount, "amount");

    BigInteger previousBalance = balanceOf(asset);
    BigInteger previousSupply = syntheticSupply;
    BigInteger nextBalance = previousBalance.add(amount);
    balances.put(asset.symbol(), nextBalance);
    syntheticSupply = previousSupply.add(amount);
    undoLog.record(() -> revert(asset.symbol(), previousBalance, previousSupply));
    changed.add(asset.symbol());
    return nextBalance;
  }

  public BigInteger debit(String symbol, BigInteger amount) {
    Asset asset = assetRegistry.require(symbol);
    Amounts.requirePositive(amount, "amount");

    BigInteger previousBalance = balanceOf(asset);
    if (previousBalance.compareTo(amount) < 0) {
      throw new InsufficientReservesException(asset.symbol(), amount, previousBalance);
    }
    BigInteger previousSupply = syntheticSupply;
    BigInteger nextBalance = previousBalance.subtract(amount);
    balances.put(asset.symbol(), nextBalance);
    syntheticSupply = previousSupply.subtract(amount);
    undoLog.record(() -> revert(asset.symbol(), previousBalance, previousSupply));
    changed.add(asset.symbol());
    return nextBalance;
  }

  public BigInteger balanceOf(String symbol) {
    Asset asset =
        assetRegistry.find(symbol).orElseThrow(() -> new UnsupportedAssetException(symbol));
    return balanceOf(asset);
  }

  public Map<String, BigInteger> balances() {
    Map<String, BigInteger> snapshot = new LinkedHashMap<>();
    for (Asset asset : assetRegistry.all()) {
      snapshot.put(asset.symbol(), balanceOf(asset));
    }
    return Collections.unmodifiableMap(snapshot);
  }

  public BigInteger totalReserves() {
    return balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
  }

  public BigInteger syntheticSupply() {
    return syntheticSupply;
  }

  public boolean isFullyBacked() {
    return totalReserves().equals(syntheticSupply);
  }

  /** Balances touched by the running transaction, keyed by asset symbol. */
  public Map<String, BigInteger> changedBalances() {
    Map<String, BigInteger> snapshot = new LinkedHashMap<>();
    for (String symbol : changed.keys()) {
      snapshot.put(symbol, balances.get(symbol));
    }
    return snapshot;
  }

  /**
   * Loads persisted balances into an idle ledger. The synthetic supply is the sum of the loaded
   * balances, which keeps the ledger fully backed.
   */
  public void restore(Map<String, BigInteger> persisted) {
    if (undoLog.isActive()) {
      throw new IllegalStateException("Cannot restore reserves during a transaction");
    }
    balances.clear();
    syntheticSupply = BigInteger.ZERO;
    persisted.forEach(
        (symbol, balance) -> {
          Asset asset =
              assetRegistry.find(symbol).orElseThrow(() -> new UnsupportedAssetException(symbol));
          Amounts.requireNonNegative(balance, "balance");
          balances.put(asset.symbol(), balance);
          syntheticSupply = syntheticSupply.add(balance);
        });
  }

  @Override
  public void begin() {
    undoLog.begin();
    changed.clear();
  }

  @Override
  public void commit() {
    undoLog.commit();
    changed.clear();
  }

  @Override
  public void rollback() {
    undoLog.rollback();
    changed.clear();
  }

  private BigInteger balanceOf(Asset asset) {
    return balances.getOrDefault(asset.symbol(), BigInteger.ZERO);
  }

  private void revert(String symbol, BigInteger balance, BigInteger supply) {
    balances.put(symbol, balance);
    syntheticSupply = supply;
  }
}
