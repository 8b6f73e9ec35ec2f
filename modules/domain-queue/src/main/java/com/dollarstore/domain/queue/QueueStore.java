package com.dollarstore.domain.queue;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.common.ChangeSet;
import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.domain.common.UndoLog;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.LongSupplier;

/**
 * Redemption queue positions. Open positions of one asset form a chain ordered by id, and fills
 * always start at the head of the chain.
 *
 * <p>Ids come from an internal counter starting at 1, or from an external monotonic source such
 * as a database sequence. External ids are never handed back on rollback.
 */
public final class QueueStore implements TransactionalStore {
  private final Map<Long, QueuePosition> positions = new HashMap<>();
  private final Map<String, TreeMap<Long, QueuePosition>> openChains = new HashMap<>();
  private final Map<String, BigInteger> depths = new HashMap<>();
  private final UndoLog undoLog = new UndoLog();
  private final ChangeSet<Long> changed = new ChangeSet<>();
  private final LongSupplier idSource;
  private long nextId = 1L;

  public QueueStore() {
    this.idSource = null;
  }

  public QueueStore(LongSupplier idSource) {
    this.idSource = Objects.requireNonNull(idSource, "idSource must not be null");
  }

  public QueuePosition enqueue(String asset, BigInteger amount, String owner, Instant now) {
    Amounts.requireNonBlank(asset, "asset");
    Amounts.requireNonBlank(owner, "owner");
    Amounts.requirePositive(amount, "amount");

    QueuePosition position = QueuePosition.createNew(allocateId(), owner, asset, amount, now);
    store(position);
    adjustDepth(asset, amount);
    return position;
  }

  public List<QueueFill> drain(String asset, BigInteger available, Instant now) {
    Amounts.requireNonBlank(asset, "asset");
    Amounts.requireNonNegative(available, "available");

    List<QueueFill> fills = new ArrayList<>();
    TreeMap<Long, QueuePosition> chain = openChains.get(asset);
    BigInteger left = available;
    while (left.signum() > 0 && chain != null && !chain.isEmpty()) {
      QueuePosition head = chain.firstEntry().getValue();
      BigInteger fillAmount = Amounts.min(head.remainingAmount(), left);
      QueuePosition filled = head.fill(fillAmount, now);
      store(filled);
      adjustDepth(asset, fillAmount.negate());
      fills.add(
          new QueueFill(
              filled.id(),
              filled.owner(),
              filled.asset(),
              fillAmount,
              filled.remainingAmount(),
              filled.status(),
              filled.createdAt()));
      left = left.subtract(fillAmount);
    }
    return fills;
  }

  public QueuePosition cancel(long positionId, String caller, Instant now) {
    QueuePosition position = requireOpen(positionId);
    if (!position.owner().equals(caller)) {
      throw new NotOwnerException(positionId, caller);
    }
    QueuePosition cancelled = position.cancel(now);
    store(cancelled);
    adjustDepth(cancelled.asset(), cancelled.remainingAmount().negate());
    return cancelled;
  }

  public BigInteger depth(String asset) {
    return depths.getOrDefault(asset, BigInteger.ZERO);
  }

  public QueuePositionInfo positionInfo(long positionId) {
    QueuePosition position = requireOpen(positionId);
    NavigableMap<Long, QueuePosition> ahead =
        openChains.get(position.asset()).headMap(positionId, false);
    BigInteger amountAhead = BigInteger.ZERO;
    for (QueuePosition other : ahead.values()) {
      amountAhead = amountAhead.add(other.remainingAmount());
    }
    return new QueuePositionInfo(amountAhead, ahead.size() + 1);
  }

  public Optional<QueuePosition> find(long positionId) {
    return Optional.ofNullable(positions.get(positionId));
  }

  public List<QueuePosition> openPositions(String asset) {
    TreeMap<Long, QueuePosition> chain = openChains.get(asset);
    if (chain == null) {
      return List.of();
    }
    return List.copyOf(chain.values());
  }

  public List<QueuePosition> positionsOf(String owner) {
    List<QueuePosition> owned = new ArrayList<>();
    for (TreeMap<Long, QueuePosition> chain : openChains.values()) {
      for (QueuePosition position : chain.values()) {
        if (position.owner().equals(owner)) {
          owned.add(position);
        }
      }
    }
    owned.sort(Comparator.comparingLong(QueuePosition::id));
    return owned;
  }

  /** Positions created or updated by the running transaction, in the order first touched. */
  public List<QueuePosition> changedPositions() {
    List<QueuePosition> touched = new ArrayList<>();
    for (Long id : changed.keys()) {
      touched.add(positions.get(id));
    }
    return touched;
  }

  /** Loads a persisted position, open or terminal, into an idle store. */
  public void restore(QueuePosition position) {
    Objects.requireNonNull(position, "position must not be null");
    if (undoLog.isActive()) {
      throw new IllegalStateException("Cannot restore queue positions during a transaction");
    }
    QueuePosition previous = positions.get(position.id());
    if (previous != null && previous.isOpen()) {
      adjustDepth(previous.asset(), previous.remainingAmount().negate());
    }
    store(position);
    if (position.isOpen()) {
      adjustDepth(position.asset(), position.remainingAmount());
    }
    nextId = Math.max(nextId, position.id() + 1);
    changed.clear();
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

  private long allocateId() {
    if (idSource != null) {
      long id = idSource.getAsLong();
      if (id < nextId) {
        throw new IllegalStateException(
            "Queue position id " + id + " is below the next expected id " + nextId);
      }
      nextId = id + 1;
      return id;
    }
    long previousNextId = nextId;
    nextId = previousNextId + 1;
    undoLog.record(() -> nextId = previousNextId);
    return previousNextId;
  }

  private QueuePosition requireOpen(long positionId) {
    QueuePosition position = positions.get(positionId);
    if (position == null || !position.isOpen()) {
      throw new PositionNotFoundException(positionId);
    }
    return position;
  }

  private void store(QueuePosition position) {
    long id = position.id();
    TreeMap<Long, QueuePosition> chain =
        openChains.computeIfAbsent(position.asset(), ignored -> new TreeMap<>());
    QueuePosition previous = positions.put(id, position);
    QueuePosition previousOpen = position.isOpen() ? chain.put(id, position) : chain.remove(id);
    undoLog.record(
        () -> {
          revert(positions, id, previous);
          revert(chain, id, previousOpen);
        });
    changed.add(id);
  }

  private void adjustDepth(String asset, BigInteger delta) {
    BigInteger previous = depth(asset);
    depths.put(asset, previous.add(delta));
    undoLog.record(() -> depths.put(asset, previous));
  }

  private static void revert(Map<Long, QueuePosition> target, long id, QueuePosition value) {
    if (value == null) {
      target.remove(id);
    } else {
      target.put(id, value);
    }
  }
}
