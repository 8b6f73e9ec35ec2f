package com.dollarstore.exchangeapi.token;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.common.ChangeSet;
import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.domain.common.UndoLog;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** In-process token simulation. Joins engine transactions through its undo log. */
public final class InMemoryTokenLedger implements TokenLedger, TransactionalStore {
  private final String symbol;
  private final int decimals;
  private final Map<String, BigInteger> balances = new HashMap<>();
  private final Map<AllowanceKey, BigInteger> allowances = new HashMap<>();
  private final UndoLog undoLog = new UndoLog();
  private final ChangeSet<String> changedBalances = new ChangeSet<>();
  private final ChangeSet<AllowanceKey> changedAllowances = new ChangeSet<>();
  private BigInteger totalSupply = BigInteger.ZERO;

  public InMemoryTokenLedger(String symbol, int decimals) {
    this.symbol = Amounts.requireNonBlank(symbol, "symbol");
    if (decimals < 0) {
      throw new IllegalArgumentException("decimals must be >= 0");
    }
    this.decimals = decimals;
  }

  @Override
  public String symbol() {
    return symbol;
  }

  @Override
  public int decimals() {
    return decimals;
  }

  @Override
  public BigInteger balanceOf(String account) {
    return balances.getOrDefault(account, BigInteger.ZERO);
  }

  @Override
  public BigInteger allowance(String owner, String spender) {
    return allowances.getOrDefault(new AllowanceKey(owner, spender), BigInteger.ZERO);
  }

  @Override
  public void approve(String owner, String spender, BigInteger amount) {
    Amounts.requireNonBlank(owner, "owner");
    Amounts.requireNonBlank(spender, "spender");
    Amounts.requireNonNegative(amount, "amount");
    setAllowance(new AllowanceKey(owner, spender), amount);
  }

  @Override
  public void transfer(String from, String to, BigInteger amount) {
    Amounts.requireNonBlank(to, "to");
    Amounts.requirePositive(amount, "amount");
    requireBalance(from, amount);
    setBalance(from, balanceOf(from).subtract(amount));
    setBalance(to, balanceOf(to).add(amount));
  }

  @Override
  public void transferFrom(String spender, String from, String to, BigInteger amount) {
    Amounts.requirePositive(amount, "amount");
    AllowanceKey key = new AllowanceKey(from, spender);
    BigInteger allowed = allowance(from, spender);
    if (allowed.compareTo(amount) < 0) {
      throw new InsufficientAllowanceException(from, spender, symbol, amount, allowed);
    }
    transfer(from, to, amount);
    setAllowance(key, allowed.subtract(amount));
  }

  @Override
  public void mint(String to, BigInteger amount) {
    Amounts.requireNonBlank(to, "to");
    Amounts.requirePositive(amount, "amount");
    setBalance(to, balanceOf(to).add(amount));
    setTotalSupply(totalSupply.add(amount));
  }

  @Override
  public void burn(String from, BigInteger amount) {
    Amounts.requirePositive(amount, "amount");
    requireBalance(from, amount);
    setBalance(from, balanceOf(from).subtract(amount));
    setTotalSupply(totalSupply.subtract(amount));
  }

  @Override
  public BigInteger totalSupply() {
    return totalSupply;
  }

  /** Balances touched by the running transaction, keyed by account. */
  public Map<String, BigInteger> changedBalances() {
    Map<String, BigInteger> snapshot = new LinkedHashMap<>();
    for (String account : changedBalances.keys()) {
      snapshot.put(account, balanceOf(account));
    }
    return snapshot;
  }

  public List<TokenAllowance> changedAllowances() {
    List<TokenAllowance> touched = new ArrayList<>();
    for (AllowanceKey key : changedAllowances.keys()) {
      touched.add(
          new TokenAllowance(
              key.owner(), key.spender(), allowance(key.owner(), key.spender())));
    }
    return touched;
  }

  /** Loads a persisted balance into an idle ledger; total supply follows the loaded balances. */
  public void restoreBalance(String account, BigInteger balance) {
    Amounts.requireNonBlank(account, "account");
    Amounts.requireNonNegative(balance, "balance");
    requireIdle();
    BigInteger previous = balances.put(account, balance);
    totalSupply =
        totalSupply.subtract(previous == null ? BigInteger.ZERO : previous).add(balance);
  }

  public void restoreAllowance(TokenAllowance allowance) {
    Objects.requireNonNull(allowance, "allowance must not be null");
    requireIdle();
    allowances.put(new AllowanceKey(allowance.owner(), allowance.spender()), allowance.amount());
  }

  @Override
  public void begin() {
    undoLog.begin();
    clearChanges();
  }

  @Override
  public void commit() {
    undoLog.commit();
    clearChanges();
  }

  @Override
  public void rollback() {
    undoLog.rollback();
    clearChanges();
  }

  private void clearChanges() {
    changedBalances.clear();
    changedAllowances.clear();
  }

  private void requireIdle() {
    if (undoLog.isActive()) {
      throw new IllegalStateException("Cannot restore " + symbol + " during a transaction");
    }
  }

  private void requireBalance(String account, BigInteger amount) {
    Amounts.requireNonBlank(account, "account");
    BigInteger available = balanceOf(account);
    if (available.compareTo(amount) < 0) {
      throw new InsufficientBalanceException(account, symbol, amount, available);
    }
  }

  private void setBalance(String account, BigInteger next) {
    BigInteger previous = balances.put(account, next);
    undoLog.record(() -> revert(balances, account, previous));
    changedBalances.add(account);
  }

  private void setAllowance(AllowanceKey key, BigInteger next) {
    BigInteger previous = allowances.put(key, next);
    undoLog.record(() -> revert(allowances, key, previous));
    changedAllowances.add(key);
  }

  private void setTotalSupply(BigInteger next) {
    BigInteger previous = totalSupply;
    totalSupply = next;
    undoLog.record(() -> totalSupply = previous);
  }

  private static <K> void revert(Map<K, BigInteger> map, K key, BigInteger previous) {
    if (previous == null) {
      map.remove(key);
    } else {
      map.put(key, previous);
    }
  }

  private record AllowanceKey(String owner, String spender) {
    AllowanceKey {
      Objects.requireNonNull(owner, "owner must not be null");
      Objects.requireNonNull(spender, "spender must not be null");
    }
  }
}
