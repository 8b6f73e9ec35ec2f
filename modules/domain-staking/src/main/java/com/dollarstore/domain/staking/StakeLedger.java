package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.common.ChangeSet;
import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.domain.common.UndoLog;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class StakeLedger implements TransactionalStore {
  private final StakingPolicy policy;
  private final Map<String, StakeAccount> accounts = new HashMap<>();
  private final UndoLog undoLog = new UndoLog();
  private final ChangeSet<String> changed = new ChangeSet<>();
  private BigInteger totalStaked = BigInteger.ZERO;

  public StakeLedger(StakingPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy must not be null");
  }

  public StakeAccount stake(String owner, BigInteger amount, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    Amounts.requirePositive(amount, "amount");
    StakeAccount current = account(owner);
    if (current.status() == StakeStatus.UNSTAKING) {
      throw new AlreadyUnstakingException(owner);
    }
    StakeAccount next;
    if (current.status() == StakeStatus.NONE) {
      next = new StakeAccount(owner, amount, StakeStatus.STAKED, now, null);
    } else {
      // additional stake keeps the original ramp start
      next =
          new StakeAccount(
              owner,
              current.stakedAmount().add(amount),
              StakeStatus.STAKED,
              current.stakeStartedAt(),
              null);
    }
    put(next);
    adjustTotal(amount);
    return next;
  }

  public StakeAccount unstake(String owner, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    StakeAccount current = account(owner);
    if (current.status() == StakeStatus.UNSTAKING) {
      throw new AlreadyUnstakingException(owner);
    }
    if (current.status() == StakeStatus.NONE || current.stakedAmount().signum() == 0) {
      throw new NotStakedException(owner);
    }
    StakeAccount next =
        new StakeAccount(
            owner, current.stakedAmount(), StakeStatus.UNSTAKING, current.stakeStartedAt(), now);
    put(next);
    return next;
  }

  public BigInteger completeUnstake(String owner, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    StakeAccount current = requireUnstaking(owner);
    Instant availableAt = current.unstakeAvailableAt(policy);
    if (now.isBefore(availableAt)) {
      throw new CooldownNotCompleteException(owner, availableAt);
    }
    BigInteger released = current.stakedAmount();
    put(StakeAccount.none(owner));
    adjustTotal(released.negate());
    return released;
  }

  public StakeAccount cancelUnstake(String owner, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    StakeAccount current = requireUnstaking(owner);
    StakeAccount next =
        new StakeAccount(owner, current.stakedAmount(), StakeStatus.STAKED, now, null);
    put(next);
    return next;
  }

  public StakeAccount account(String owner) {
    Amounts.requireNonBlank(owner, "owner");
    return accounts.getOrDefault(owner, StakeAccount.none(owner));
  }

  public BigInteger power(String owner, Instant now) {
    return account(owner).power(now, policy);
  }

  public BigInteger totalStaked() {
    return totalStaked;
  }

  public StakingPolicy policy() {
    return policy;
  }

  public List<StakeAccount> changedAccounts() {
    List<StakeAccount> touched = new ArrayList<>();
    for (String owner : changed.keys()) {
      touched.add(accounts.get(owner));
    }
    return touched;
  }

  /** Loads a persisted account into an idle ledger; the staked total follows the loaded amounts. */
  public void restore(StakeAccount account) {
    Objects.requireNonNull(account, "account must not be null");
    if (undoLog.isActive()) {
      throw new IllegalStateException("Cannot restore stake accounts during a transaction");
    }
    StakeAccount previous = accounts.put(account.owner(), account);
    BigInteger previousAmount = previous == null ? BigInteger.ZERO : previous.stakedAmount();
    totalStaked = totalStaked.subtract(previousAmount).add(account.stakedAmount());
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

  private StakeAccount requireUnstaking(String owner) {
    StakeAccount current = account(owner);
    if (current.status() != StakeStatus.UNSTAKING) {
      throw new NotUnstakingException(owner);
    }
    return current;
  }

  private void put(StakeAccount account) {
    String owner = account.owner();
    StakeAccount previous = accounts.put(owner, account);
    undoLog.record(
        () -> {
          if (previous == null) {
            accounts.remove(owner);
          } else {
            accounts.put(owner, previous);
          }
        });
    changed.add(owner);
  }

  private void adjustTotal(BigInteger delta) {
    BigInteger previous = totalStaked;
    totalStaked = previous.add(delta);
    undoLog.record(() -> totalStaked = previous);
  }
}
