package com.dollarstore.domain.emission;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.domain.common.UndoLog;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks reward emission against the per-category caps. Requests beyond a cap are clipped to the
 * remaining allowance. Every user mint vests the founder allocation up to a fixed share of the
 * cumulative user emission.
 */
public final class EmissionAllocator implements TransactionalStore {
  private final EmissionSchedule schedule;
  private final String founderAccount;
  private final UndoLog undoLog = new UndoLog();
  private EmissionState state;
  private boolean changed;

  public EmissionAllocator(
      EmissionState initialState, EmissionSchedule schedule, String founderAccount) {
    this.state = Objects.requireNonNull(initialState, "initialState must not be null");
    this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
    this.founderAccount = Amounts.requireNonBlank(founderAccount, "founderAccount");
  }

  public List<EmissionGrant> mintMaker(String recipient, BigInteger amount) {
    return mintUser(EmissionCategory.MAKER, recipient, amount);
  }

  public List<EmissionGrant> mintTaker(String recipient, BigInteger amount) {
    return mintUser(EmissionCategory.TAKER, recipient, amount);
  }

  public EmissionState state() {
    return state;
  }

  public EmissionSchedule schedule() {
    return schedule;
  }

  public String founderAccount() {
    return founderAccount;
  }

  /** The state, if the running transaction minted anything. */
  public Optional<EmissionState> changedState() {
    return changed ? Optional.of(state) : Optional.empty();
  }

  /** Loads persisted minted totals into an idle allocator, keeping the configured caps. */
  public void restoreMinted(
      BigInteger makerMinted, BigInteger takerMinted, BigInteger founderVested) {
    if (undoLog.isActive()) {
      throw new IllegalStateException("Cannot restore emission during a transaction");
    }
    state =
        new EmissionState(
            state.makerCap(),
            makerMinted,
            state.takerCap(),
            takerMinted,
            state.founderCap(),
            founderVested);
  }

  @Override
  public void begin() {
    undoLog.begin();
    changed = false;
  }

  @Override
  public void commit() {
    undoLog.commit();
    changed = false;
  }

  @Override
  public void rollback() {
    undoLog.rollback();
    changed = false;
  }

  private List<EmissionGrant> mintUser(
      EmissionCategory category, String recipient, BigInteger amount) {
    Amounts.requireNonBlank(recipient, "recipient");
    Amounts.requireNonNegative(amount, "amount");
    List<EmissionGrant> grants = new ArrayList<>();
    BigInteger granted = Amounts.min(amount, state.remaining(category));
    if (granted.signum() > 0) {
      apply(state.plus(category, granted));
      grants.add(new EmissionGrant(category, recipient, amount, granted));
    }
    BigInteger founderDelta = founderVestingDelta();
    if (founderDelta.signum() > 0) {
      apply(state.plus(EmissionCategory.FOUNDER, founderDelta));
      grants.add(
          new EmissionGrant(EmissionCategory.FOUNDER, founderAccount, founderDelta, founderDelta));
    }
    return grants;
  }

  private BigInteger founderVestingDelta() {
    BigInteger entitled =
        state.userMinted().divide(BigInteger.valueOf(schedule.founderShareDivisor()));
    BigInteger target = Amounts.min(entitled, state.founderCap());
    return target.subtract(state.founderVested()).max(BigInteger.ZERO);
  }

  private void apply(EmissionState next) {
    EmissionState previous = state;
    state = next;
    undoLog.record(() -> state = previous);
    changed = true;
  }
}
