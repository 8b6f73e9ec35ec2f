package com.dollarstore.domain.common;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Records compensating actions for the changes made inside a transaction. Rollback replays them
 * newest first. Changes made outside a transaction are not recorded.
 */
public final class UndoLog {
  private final Deque<Runnable> actions = new ArrayDeque<>();
  private boolean active;

  public void begin() {
    if (active) {
      throw new IllegalStateException("Transaction already active");
    }
    actions.clear();
    active = true;
  }

  public void record(Runnable undo) {
    Objects.requireNonNull(undo, "undo must not be null");
    if (active) {
      actions.push(undo);
    }
  }

  public void commit() {
    actions.clear();
    active = false;
  }

  public void rollback() {
    while (!actions.isEmpty()) {
      actions.pop().run();
    }
    active = false;
  }

  public boolean isActive() {
    return active;
  }

  public int size() {
    return actions.size();
  }
}
