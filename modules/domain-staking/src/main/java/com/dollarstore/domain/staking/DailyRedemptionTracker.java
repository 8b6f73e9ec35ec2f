package com.dollarstore.domain.staking;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.common.ChangeSet;
import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.domain.common.UndoLog;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Synthetic amount each account has redeemed during the current UTC day. */
public final class DailyRedemptionTracker implements TransactionalStore {
  private final Map<String, DailyRedemption> usage = new HashMap<>();
  private final UndoLog undoLog = new UndoLog();
  private final ChangeSet<String> changed = new ChangeSet<>();

  public BigInteger record(String owner, BigInteger amount, Instant now) {
    Amounts.requireNonBlank(owner, "owner");
    Amounts.requirePositive(amount, "amount");
    LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
    BigInteger usedToday = used(owner, now).add(amount);
    DailyRedemption previous = usage.put(owner, new DailyRedemption(owner, today, usedToday));
    undoLog.record(
        () -> {
          if (previous == null) {
            usage.remove(owner);
          } else {
            usage.put(owner, previous);
          }
        });
    changed.add(owner);
    return usedToday;
  }

  public BigInteger used(String owner, Instant now) {
    DailyRedemption current = usage.get(owner);
    if (current == null || !current.day().equals(LocalDate.ofInstant(now, ZoneOffset.UTC))) {
      return BigInteger.ZERO;
    }
    return current.used();
  }

  public List<DailyRedemption> changedRedemptions() {
    List<DailyRedemption> touched = new ArrayList<>();
    for (String owner : changed.keys()) {
      touched.add(usage.get(owner));
    }
    return touched;
  }

  public void restore(DailyRedemption redemption) {
    Objects.requireNonNull(redemption, "redemption must not be null");
    if (undoLog.isActive()) {
      throw new IllegalStateException("Cannot restore redemptions during a transaction");
    }
    usage.put(redemption.owner(), redemption);
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
}
