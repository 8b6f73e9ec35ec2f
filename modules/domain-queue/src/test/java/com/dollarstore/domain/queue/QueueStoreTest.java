package com.dollarstore.domain.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dollarstore.domain.common.ErrorCode;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueueStoreTest {
  private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

  private QueueStore store;

  @BeforeEach
  void setUp() {
    store = new QueueStore();
  }

  @Test
  void shouldAssignMonotonicIdsAcrossAssets() {
    QueuePosition first = store.enqueue("USDC", amount(100), "alice", T0);
    QueuePosition second = store.enqueue("USDT", amount(100), "bob", T0);
    QueuePosition third = store.enqueue("USDC", amount(100), "carol", T0);

    assertEquals(1L, first.id());
    assertEquals(2L, second.id());
    assertEquals(3L, third.id());
    assertEquals(QueueStatus.ACTIVE, first.status());
  }

  @Test
  void shouldDrainOldestPositionsFirstAndPartiallyFillTheNext() {
    QueuePosition a = store.enqueue("USDC", amount(200), "alice", T0);
    QueuePosition b = store.enqueue("USDC", amount(300), "bob", T0.plusSeconds(1));

    List<QueueFill> fills = store.drain("USDC", amount(250), T0.plusSeconds(60));

    assertEquals(2, fills.size());
    assertEquals(a.id(), fills.get(0).positionId());
    assertEquals(amount(200), fills.get(0).filledAmount());
    assertEquals(QueueStatus.FILLED, fills.get(0).statusAfter());
    assertEquals(b.id(), fills.get(1).positionId());
    assertEquals(amount(50), fills.get(1).filledAmount());
    assertEquals(amount(250), fills.get(1).remainingAmount());
    assertEquals(QueueStatus.PARTIALLY_FILLED, fills.get(1).statusAfter());
    assertEquals(QueueStatus.FILLED, store.find(a.id()).orElseThrow().status());
    assertEquals(amount(250), store.depth("USDC"));
    assertEquals(List.of(b.id()), store.openPositions("USDC").stream().map(QueuePosition::id).toList());
  }

  @Test
  void shouldStopDrainWhenChainIsEmpty() {
    store.enqueue("USDC", amount(40), "alice", T0);

    List<QueueFill> fills = store.drain("USDC", amount(100), T0);

    assertEquals(1, fills.size());
    assertEquals(BigInteger.ZERO, store.depth("USDC"));
    assertTrue(store.drain("USDT", amount(100), T0).isEmpty());
  }

  @Test
  void shouldNotTouchOtherAssetChains() {
    store.enqueue("USDT", amount(75), "alice", T0);

    store.drain("USDC", amount(100), T0);

    assertEquals(amount(75), store.depth("USDT"));
  }

  @Test
  void shouldCancelPartiallyFilledPositionAndReturnRemainder() {
    store.enqueue("USDC", amount(200), "alice", T0);
    QueuePosition b = store.enqueue("USDC", amount(300), "bob", T0);
    store.drain("USDC", amount(250), T0);

    QueuePosition cancelled = store.cancel(b.id(), "bob", T0.plusSeconds(30));

    assertEquals(QueueStatus.CANCELLED, cancelled.status());
    assertEquals(amount(250), cancelled.remainingAmount());
    assertEquals(BigInteger.ZERO, store.depth("USDC"));
    PositionNotFoundException again =
        assertThrows(PositionNotFoundException.class, () -> store.cancel(b.id(), "bob", T0));
    assertEquals(ErrorCode.POSITION_NOT_FOUND, again.code());
  }

  @Test
  void shouldRejectCancelByNonOwner() {
    QueuePosition position = store.enqueue("USDC", amount(10), "alice", T0);

    NotOwnerException ex =
        assertThrows(NotOwnerException.class, () -> store.cancel(position.id(), "mallory", T0));

    assertEquals(ErrorCode.NOT_OWNER, ex.code());
    assertEquals(amount(10), store.depth("USDC"));
  }

  @Test
  void shouldRejectCancelOfUnknownPosition() {
    assertThrows(PositionNotFoundException.class, () -> store.cancel(99L, "alice", T0));
  }

  @Test
  void shouldReportAmountAheadAndPositionNumber() {
    QueuePosition a = store.enqueue("USDC", amount(200), "alice", T0);
    QueuePosition b = store.enqueue("USDC", amount(300), "bob", T0);
    QueuePosition c = store.enqueue("USDC", amount(50), "carol", T0);
    store.drain("USDC", amount(20), T0);

    assertEquals(new QueuePositionInfo(BigInteger.ZERO, 1), store.positionInfo(a.id()));
    assertEquals(new QueuePositionInfo(amount(180), 2), store.positionInfo(b.id()));
    assertEquals(new QueuePositionInfo(amount(480), 3), store.positionInfo(c.id()));
  }

  @Test
  void shouldRejectPositionInfoForFilledPosition() {
    QueuePosition a = store.enqueue("USDC", amount(20), "alice", T0);
    store.drain("USDC", amount(20), T0);

    assertThrows(PositionNotFoundException.class, () -> store.positionInfo(a.id()));
  }

  @Test
  void shouldKeepDepthEqualToSumOfOpenRemainders() {
    store.enqueue("USDC", amount(120), "alice", T0);
    QueuePosition b = store.enqueue("USDC", amount(80), "bob", T0);
    store.enqueue("USDC", amount(40), "carol", T0);
    store.drain("USDC", amount(130), T0);
    store.cancel(b.id(), "bob", T0);

    BigInteger sum =
        store.openPositions("USDC").stream()
            .map(QueuePosition::remainingAmount)
            .reduce(BigInteger.ZERO, BigInteger::add);
    assertEquals(sum, store.depth("USDC"));
    assertEquals(amount(40), sum);
  }

  @Test
  void shouldListOpenPositionsOfOwnerAcrossAssets() {
    store.enqueue("USDT", amount(5), "alice", T0);
    store.enqueue("USDC", amount(5), "bob", T0);
    store.enqueue("USDC", amount(5), "alice", T0);

    assertEquals(
        List.of(1L, 3L), store.positionsOf("alice").stream().map(QueuePosition::id).toList());
  }

  @Test
  void shouldRestorePositionsDepthAndIdsOnRollback() {
    QueuePosition a = store.enqueue("USDC", amount(200), "alice", T0);

    store.begin();
    store.enqueue("USDC", amount(300), "bob", T0);
    store.drain("USDC", amount(250), T0);
    store.rollback();

    assertEquals(amount(200), store.depth("USDC"));
    assertEquals(QueueStatus.ACTIVE, store.find(a.id()).orElseThrow().status());
    assertTrue(store.find(2L).isEmpty());
    assertEquals(2L, store.enqueue("USDC", amount(1), "carol", T0).id());
  }

  @Test
  void shouldNotReuseExternalIdsAfterRollback() {
    AtomicLong sequence = new AtomicLong(40);
    QueueStore sequenced = new QueueStore(sequence::incrementAndGet);

    sequenced.begin();
    assertEquals(41L, sequenced.enqueue("USDC", amount(1), "alice", T0).id());
    sequenced.rollback();

    assertTrue(sequenced.find(41L).isEmpty());
    assertEquals(42L, sequenced.enqueue("USDC", amount(1), "alice", T0).id());
  }

  @Test
  void shouldRebuildChainsAndDepthFromRestoredPositions() {
    store.restore(
        new QueuePosition(
            4L, "alice", "USDC", amount(100), amount(0), QueueStatus.FILLED, T0, T0));
    store.restore(
        new QueuePosition(
            7L, "bob", "USDC", amount(300), amount(120), QueueStatus.PARTIALLY_FILLED, T0, T0));
    store.restore(
        new QueuePosition(9L, "carol", "USDC", amount(50), amount(50), QueueStatus.ACTIVE, T0, T0));

    assertEquals(amount(170), store.depth("USDC"));
    assertEquals(List.of(7L, 9L), store.openPositions("USDC").stream().map(QueuePosition::id).toList());
    assertEquals(QueueStatus.FILLED, store.find(4L).orElseThrow().status());
    assertEquals(new QueuePositionInfo(amount(120), 2), store.positionInfo(9L));
    assertEquals(10L, store.enqueue("USDC", amount(1), "dave", T0).id());
  }

  @Test
  void shouldListPositionsTouchedByRunningTransaction() {
    QueuePosition a = store.enqueue("USDC", amount(200), "alice", T0);

    store.begin();
    QueuePosition b = store.enqueue("USDC", amount(300), "bob", T0);
    store.drain("USDC", amount(250), T0.plusSeconds(5));

    List<QueuePosition> changed = store.changedPositions();
    assertEquals(List.of(b.id(), a.id()), changed.stream().map(QueuePosition::id).toList());
    assertEquals(amount(250), changed.get(0).remainingAmount());
    assertEquals(QueueStatus.FILLED, changed.get(1).status());

    store.commit();
    assertTrue(store.changedPositions().isEmpty());
  }

  @Test
  void shouldRejectRestoreDuringTransaction() {
    store.begin();

    assertThrows(
        IllegalStateException.class,
        () ->
            store.restore(
                new QueuePosition(
                    1L, "alice", "USDC", amount(1), amount(1), QueueStatus.ACTIVE, T0, T0)));
  }

  private static BigInteger amount(long dollars) {
    return BigInteger.valueOf(dollars).multiply(BigInteger.TEN.pow(18));
  }
}
