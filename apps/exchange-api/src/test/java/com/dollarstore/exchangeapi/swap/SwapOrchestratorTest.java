package com.dollarstore.exchangeapi.swap;

import static com.dollarstore.exchangeapi.ExchangeFixture.CUSTODY;
import static com.dollarstore.exchangeapi.ExchangeFixture.dollars;
import static com.dollarstore.exchangeapi.ExchangeFixture.micros;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;
import com.dollarstore.domain.common.ZeroAmountException;
import com.dollarstore.domain.queue.NotOwnerException;
import com.dollarstore.domain.queue.QueueFill;
import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.queue.QueueStatus;
import com.dollarstore.domain.reserve.InsufficientReservesException;
import com.dollarstore.domain.reserve.InvalidPrecisionException;
import com.dollarstore.domain.reserve.UnsupportedAssetException;
import com.dollarstore.exchangeapi.ExchangeFixture;
import com.dollarstore.exchangeapi.engine.ExchangeEvent;
import com.dollarstore.exchangeapi.reconciliation.ReconciliationStatus;
import com.dollarstore.exchangeapi.token.InsufficientAllowanceException;
import com.dollarstore.infra.kafka.contract.EventTypes;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SwapOrchestratorTest {
  private ExchangeFixture exchange;
  private SwapOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    exchange = new ExchangeFixture();
    orchestrator = exchange.swapOrchestrator;
  }

  @Test
  void shouldMintSyntheticOneToOneOnDeposit() {
    exchange.fund("alice", "USDC", micros(100));

    DepositResult result =
        orchestrator.deposit(new DepositCommand("alice", "usdc", micros(100)));

    assertEquals(dollars(100), result.minted());
    assertTrue(result.fills().isEmpty());
    assertEquals(BigInteger.ZERO, result.takerReward());
    assertEquals(dollars(100), exchange.balance("DLRS", "alice"));
    assertEquals(BigInteger.ZERO, exchange.balance("USDC", "alice"));
    assertEquals(micros(100), exchange.balance("USDC", CUSTODY));
    assertEquals(dollars(100), exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(List.of(EventTypes.DEPOSITED), eventTypes());
  }

  @Test
  void shouldRejectDepositWithoutAllowance() {
    exchange.tokenService.mint("USDC", "alice", micros(10));

    InsufficientAllowanceException ex =
        assertThrows(
            InsufficientAllowanceException.class,
            () -> orchestrator.deposit(new DepositCommand("alice", "USDC", micros(10))));

    assertEquals(ErrorCode.INSUFFICIENT_ALLOWANCE, ex.code());
    assertEquals(BigInteger.ZERO, exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(BigInteger.ZERO, exchange.syntheticSupply());
  }

  @Test
  void shouldRejectZeroAndUnsupportedAmounts() {
    exchange.fund("alice", "USDC", micros(10));

    assertThrows(
        ZeroAmountException.class,
        () -> orchestrator.deposit(new DepositCommand("alice", "USDC", BigInteger.ZERO)));
    assertThrows(
        UnsupportedAssetException.class,
        () -> orchestrator.deposit(new DepositCommand("alice", "DAI", micros(10))));
    assertTrue(exchange.outbox.isEmpty());
  }

  @Test
  void shouldBurnSyntheticAndReturnNativeOnWithdraw() {
    exchange.seedReserve("alice", "USDC", 100);

    WithdrawResult result =
        orchestrator.withdraw(new WithdrawCommand("alice", "USDC", micros(40)));

    assertEquals(dollars(40), result.burned());
    assertEquals(micros(40), result.received());
    assertEquals(dollars(60), exchange.balance("DLRS", "alice"));
    assertEquals(micros(40), exchange.balance("USDC", "alice"));
    assertEquals(dollars(60), exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(dollars(40), exchange.redemptionTracker.used("alice", exchange.clock.instant()));
  }

  @Test
  void shouldFailWithdrawBeyondReservesWithoutSideEffects() {
    exchange.seedReserve("alice", "USDC", 100);
    exchange.seedReserve("alice", "USDT", 100);
    int eventsBefore = exchange.outbox.size();

    InsufficientReservesException ex =
        assertThrows(
            InsufficientReservesException.class,
            () -> orchestrator.withdraw(new WithdrawCommand("alice", "USDC", micros(150))));

    assertEquals(dollars(150), ex.requested());
    assertEquals(dollars(100), ex.available());
    assertEquals(dollars(200), exchange.balance("DLRS", "alice"));
    assertEquals(eventsBefore, exchange.outbox.size());
  }

  @Test
  void shouldSwapDirectlyWhenTargetReserveSuffices() {
    exchange.seedReserve("bob", "USDT", 500);
    exchange.fund("alice", "USDC", micros(200));

    SwapResult result =
        orchestrator.swap(new SwapCommand("alice", "USDC", "USDT", micros(200), false));

    assertEquals(micros(200), result.received());
    assertFalse(result.isQueued());
    assertNull(result.positionId());
    assertEquals(micros(200), exchange.balance("USDT", "alice"));
    assertEquals(BigInteger.ZERO, exchange.balance("DLRS", "alice"));
    assertEquals(dollars(200), exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(dollars(300), exchange.reserveLedger.balanceOf("USDT"));
    assertEquals(
        List.of(EventTypes.DEPOSITED, EventTypes.DEPOSITED, EventTypes.WITHDRAWN), eventTypes());
  }

  @Test
  void shouldQueueWholeAmountWhenTargetReserveIsEmpty() {
    exchange.seedReserve("bob", "USDT", 1000);
    exchange.fund("alice", "USDT", micros(1500));

    SwapResult result =
        orchestrator.swap(new SwapCommand("alice", "USDT", "USDC", micros(1500), true));

    assertEquals(BigInteger.ZERO, result.received());
    assertTrue(result.isQueued());
    assertEquals(dollars(1500), result.queuedAmount());
    assertEquals(dollars(2500), exchange.reserveLedger.balanceOf("USDT"));
    assertEquals(dollars(1500), exchange.queueStore.depth("USDC"));
    assertEquals(BigInteger.ZERO, exchange.balance("DLRS", "alice"));
    assertEquals(dollars(1500), exchange.balance("DLRS", CUSTODY));
    assertTrue(exchange.reserveLedger.isFullyBacked());
  }

  @Test
  void shouldWithdrawAvailableAndQueueShortfall() {
    exchange.seedReserve("bob", "USDC", 100);
    exchange.seedReserve("alice", "USDT", 300);

    SwapResult result =
        orchestrator.swapFromSynthetic(
            new SyntheticSwapCommand("alice", "USDC", dollars(250), true));

    assertEquals(micros(100), result.received());
    assertEquals(dollars(150), result.queuedAmount());
    assertEquals(BigInteger.ZERO, exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(dollars(50), exchange.balance("DLRS", "alice"));
    QueuePosition position = exchange.queueStore.find(result.positionId()).orElseThrow();
    assertEquals("alice", position.owner());
    assertEquals(QueueStatus.ACTIVE, position.status());
  }

  @Test
  void shouldLeaveEveryStoreUntouchedWhenSwapCannotComplete() {
    exchange.seedReserve("bob", "USDT", 100);
    exchange.fund("alice", "USDC", micros(150));
    int eventsBefore = exchange.outbox.size();

    assertThrows(
        InsufficientReservesException.class,
        () -> orchestrator.swap(new SwapCommand("alice", "USDC", "USDT", micros(150), false)));

    assertEquals(micros(150), exchange.balance("USDC", "alice"));
    assertEquals(micros(150), exchange.tokenRegistry.require("USDC").allowance("alice", CUSTODY));
    assertEquals(BigInteger.ZERO, exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(dollars(100), exchange.syntheticSupply());
    assertEquals(eventsBefore, exchange.outbox.size());
  }

  @Test
  void shouldRejectSameAssetSwapBeforeMovingFunds() {
    exchange.fund("alice", "USDC", micros(10));

    SameAssetSwapException ex =
        assertThrows(
            SameAssetSwapException.class,
            () -> orchestrator.swap(new SwapCommand("alice", "USDC", "usdc", micros(10), true)));

    assertEquals(ErrorCode.SAME_ASSET_SWAP, ex.code());
    assertEquals(micros(10), exchange.balance("USDC", "alice"));
  }

  @Test
  void shouldRejectSyntheticAmountNotRepresentableInTarget() {
    exchange.seedReserve("alice", "USDC", 10);

    assertThrows(
        InvalidPrecisionException.class,
        () ->
            orchestrator.swapFromSynthetic(
                new SyntheticSwapCommand("alice", "USDC", BigInteger.ONE, false)));
    assertThrows(
        InvalidPrecisionException.class,
        () -> orchestrator.joinQueue(new JoinQueueCommand("alice", "USDC", BigInteger.TEN)));
  }

  @Test
  void shouldFillQueueInArrivalOrderWhenDepositArrives() {
    exchange.seedReserve("alice", "USDT", 200);
    exchange.seedReserve("bob", "USDT", 300);
    QueuePosition first =
        orchestrator.joinQueue(new JoinQueueCommand("alice", "USDC", dollars(200)));
    QueuePosition second =
        orchestrator.joinQueue(new JoinQueueCommand("bob", "USDC", dollars(300)));
    exchange.clock.advance(Duration.ofDays(10));
    exchange.fund("carol", "USDC", micros(250));

    DepositResult result = orchestrator.deposit(new DepositCommand("carol", "USDC", micros(250)));

    List<QueueFill> fills = result.fills();
    assertEquals(2, fills.size());
    assertEquals(first.id(), fills.get(0).positionId());
    assertEquals(dollars(200), fills.get(0).filledAmount());
    assertEquals(QueueStatus.FILLED, fills.get(0).statusAfter());
    assertEquals(second.id(), fills.get(1).positionId());
    assertEquals(dollars(50), fills.get(1).filledAmount());
    assertEquals(dollars(250), fills.get(1).remainingAmount());
    assertEquals(QueueStatus.PARTIALLY_FILLED, fills.get(1).statusAfter());

    assertEquals(micros(200), exchange.balance("USDC", "alice"));
    assertEquals(micros(50), exchange.balance("USDC", "bob"));
    assertEquals(dollars(250), exchange.balance("DLRS", "carol"));
    assertEquals(dollars(250), exchange.balance("DLRS", CUSTODY));
    assertEquals(BigInteger.ZERO, exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(dollars(250), exchange.queueStore.depth("USDC"));

    // 250 cleared at 1 bps, 100M reward units per dollar
    assertEquals(BigInteger.valueOf(2_500_000L), result.takerReward());
    assertEquals(result.takerReward(), exchange.balance("CENTS", "carol"));
    assertTrue(exchange.balance("CENTS", "alice").signum() > 0);
    assertTrue(exchange.balance("CENTS", "bob").signum() > 0);
    assertTrue(exchange.balance("CENTS", ExchangeFixture.FOUNDER).signum() > 0);
    assertTrue(eventTypes().contains(EventTypes.QUEUE_FILLED));
    assertTrue(eventTypes().contains(EventTypes.REWARD_MINTED));
  }

  @Test
  void shouldRefundEscrowWhenOwnerCancels() {
    exchange.seedReserve("alice", "USDT", 100);
    QueuePosition position =
        orchestrator.joinQueue(new JoinQueueCommand("alice", "USDC", dollars(50)));
    assertEquals(dollars(50), exchange.balance("DLRS", "alice"));

    QueuePosition cancelled =
        orchestrator.cancelQueue(new CancelQueueCommand("alice", position.id()));

    assertEquals(QueueStatus.CANCELLED, cancelled.status());
    assertEquals(dollars(50), cancelled.remainingAmount());
    assertEquals(dollars(100), exchange.balance("DLRS", "alice"));
    assertEquals(BigInteger.ZERO, exchange.balance("DLRS", CUSTODY));
    assertEquals(BigInteger.ZERO, exchange.queueStore.depth("USDC"));
    assertEquals(EventTypes.QUEUE_CANCELLED, lastEvent().eventType());
  }

  @Test
  void shouldRejectCancelByAnotherAccount() {
    exchange.seedReserve("alice", "USDT", 100);
    QueuePosition position =
        orchestrator.joinQueue(new JoinQueueCommand("alice", "USDC", dollars(50)));

    NotOwnerException ex =
        assertThrows(
            NotOwnerException.class,
            () -> orchestrator.cancelQueue(new CancelQueueCommand("mallory", position.id())));

    assertEquals(ErrorCode.NOT_OWNER, ex.code());
    assertEquals(dollars(50), exchange.queueStore.depth("USDC"));
    assertEquals(dollars(50), exchange.balance("DLRS", CUSTODY));
  }

  @Test
  void shouldKeepReservesEqualToSupplyAcrossMixedActivity() {
    exchange.seedReserve("alice", "USDC", 400);
    exchange.seedReserve("bob", "USDT", 250);
    orchestrator.swapFromSynthetic(new SyntheticSwapCommand("alice", "USDT", dollars(300), true));
    orchestrator.joinQueue(new JoinQueueCommand("bob", "USDC", dollars(100)));
    exchange.seedReserve("carol", "USDT", 120);
    orchestrator.withdraw(new WithdrawCommand("alice", "USDC", micros(20)));
    exchange.seedReserve("dave", "USDC", 30);

    assertEquals(exchange.reserveLedger.totalReserves(), exchange.syntheticSupply());
    assertEquals(exchange.reserveLedger.syntheticSupply(), exchange.syntheticSupply());
    assertTrue(exchange.reserveLedger.isFullyBacked());
    assertEquals(
        exchange.queueStore.depth("USDC").add(exchange.queueStore.depth("USDT")),
        exchange.balance("DLRS", CUSTODY));
  }

  @Test
  void shouldRestoreReserveAndSupplyAfterDepositThenWithdrawOfSameAmount() {
    exchange.seedReserve("bob", "USDT", 75);
    exchange.fund("alice", "USDC", micros(40));
    BigInteger reserveBefore = exchange.reserveLedger.balanceOf("USDC");
    BigInteger supplyBefore = exchange.syntheticSupply();

    orchestrator.deposit(new DepositCommand("alice", "USDC", micros(40)));
    WithdrawResult withdrawn =
        orchestrator.withdraw(new WithdrawCommand("alice", "USDC", micros(40)));

    assertEquals(dollars(40), withdrawn.burned());
    assertEquals(micros(40), withdrawn.received());
    assertEquals(reserveBefore, exchange.reserveLedger.balanceOf("USDC"));
    assertEquals(supplyBefore, exchange.syntheticSupply());
    assertEquals(supplyBefore, exchange.reserveLedger.syntheticSupply());
    assertEquals(micros(40), exchange.balance("USDC", "alice"));
    assertEquals(BigInteger.ZERO, exchange.balance("DLRS", "alice"));
  }

  @Test
  void shouldConserveReservesAndEscrowUnderConcurrentTraffic() throws Exception {
    List<String> accounts = List.of("alice", "bob", "carol", "dave", "erin", "frank");
    for (String account : accounts) {
      exchange.fund(account, "USDC", micros(1000));
      exchange.fund(account, "USDT", micros(1000));
    }

    ExecutorService executor = Executors.newFixedThreadPool(accounts.size());
    try {
      List<Callable<Object>> traders = new ArrayList<>();
      for (int i = 0; i < accounts.size(); i++) {
        String account = accounts.get(i);
        String home = i % 2 == 0 ? "USDC" : "USDT";
        String away = i % 2 == 0 ? "USDT" : "USDC";
        traders.add(
            () -> {
              for (int round = 0; round < 20; round++) {
                attempt(() -> orchestrator.deposit(new DepositCommand(account, home, micros(10))));
                attempt(
                    () ->
                        orchestrator.swap(
                            new SwapCommand(account, home, away, micros(4), true)));
                attempt(
                    () -> {
                      QueuePosition joined =
                          orchestrator.joinQueue(new JoinQueueCommand(account, away, dollars(2)));
                      if (joined.id() % 3 == 0) {
                        orchestrator.cancelQueue(new CancelQueueCommand(account, joined.id()));
                      }
                    });
                attempt(() -> orchestrator.withdraw(new WithdrawCommand(account, away, micros(1))));
              }
              return null;
            });
      }
      for (Future<Object> future : executor.invokeAll(traders)) {
        future.get();
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(exchange.reserveLedger.totalReserves(), exchange.syntheticSupply());
    assertEquals(exchange.reserveLedger.syntheticSupply(), exchange.syntheticSupply());
    assertEquals(
        exchange.queueStore.depth("USDC").add(exchange.queueStore.depth("USDT")),
        exchange.balance("DLRS", CUSTODY));
    BigInteger openRemaining =
        exchange.queueStore.openPositions("USDC").stream()
            .map(QueuePosition::remainingAmount)
            .reduce(BigInteger.ZERO, BigInteger::add)
            .add(
                exchange.queueStore.openPositions("USDT").stream()
                    .map(QueuePosition::remainingAmount)
                    .reduce(BigInteger.ZERO, BigInteger::add));
    assertEquals(openRemaining, exchange.balance("DLRS", CUSTODY));
    assertEquals(
        ReconciliationStatus.MATCHED, exchange.reconciliationService.runOnce().status());
  }

  /** Runs a trader step, tolerating the business rejections concurrent traffic produces. */
  private static void attempt(Runnable step) {
    try {
      step.run();
    } catch (ExchangeDomainException rejected) {
      assertTrue(rejected.getMessage() != null && !rejected.getMessage().isBlank());
    }
  }

  private List<String> eventTypes() {
    return exchange.outbox.stream().map(ExchangeEvent::eventType).toList();
  }

  private ExchangeEvent lastEvent() {
    return exchange.outbox.get(exchange.outbox.size() - 1);
  }
}
