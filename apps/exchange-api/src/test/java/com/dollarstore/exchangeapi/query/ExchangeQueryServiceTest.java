package com.dollarstore.exchangeapi.query;

import static com.dollarstore.exchangeapi.ExchangeFixture.dollars;
import static com.dollarstore.exchangeapi.ExchangeFixture.micros;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dollarstore.domain.queue.PositionNotFoundException;
import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.exchangeapi.ExchangeFixture;
import com.dollarstore.exchangeapi.swap.CancelQueueCommand;
import com.dollarstore.exchangeapi.swap.DepositCommand;
import com.dollarstore.exchangeapi.swap.JoinQueueCommand;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExchangeQueryServiceTest {
  private ExchangeFixture exchange;
  private ExchangeQueryService queryService;

  @BeforeEach
  void setUp() {
    exchange = new ExchangeFixture();
    queryService = exchange.queryService;
  }

  @Test
  void shouldSummarizeReservesAgainstSupply() {
    exchange.seedReserve("alice", "USDC", 100);
    exchange.seedReserve("bob", "USDT", 50);

    ReserveSummary summary = queryService.reserves();

    assertEquals(2, summary.reserves().size());
    assertEquals(dollars(150), summary.totalReserves());
    assertEquals(dollars(150), summary.syntheticSupply());
    assertTrue(summary.fullyBacked());
    ReserveView usdc = queryService.reserve("usdc");
    assertEquals("USDC", usdc.asset());
    assertEquals(dollars(100), usdc.balance());
    assertEquals(micros(100), usdc.nativeBalance());
    assertEquals(BigInteger.ZERO, usdc.queueDepth());
  }

  @Test
  void shouldReportQueuePlacement() {
    exchange.seedReserve("alice", "USDT", 300);
    join("alice", 100);
    QueuePosition second = join("alice", 50);

    PositionView view = queryService.position(second.id());

    assertEquals("ACTIVE", view.status());
    assertEquals(Integer.valueOf(2), view.positionNumber());
    assertEquals(dollars(100), view.amountAhead());
    assertEquals(dollars(150), queryService.queueDepth("USDC"));
  }

  @Test
  void shouldScoreByTimeInQueueAndStakingPower() {
    exchange.seedReserve("alice", "USDT", 300);
    exchange.seedReserve("bob", "USDT", 300);
    exchange.fund("bob", "CENTS", micros(1000));
    exchange.stakingService.stake("bob", micros(1000));
    exchange.clock.advance(Duration.ofDays(30));
    QueuePosition unstaked = join("alice", 100);
    QueuePosition staked = join("bob", 100);

    exchange.clock.advance(Duration.ofHours(1));

    BigDecimal unstakedScore = queryService.position(unstaked.id()).fillScore();
    BigDecimal stakedScore = queryService.position(staked.id()).fillScore();
    assertEquals(0, unstakedScore.compareTo(BigDecimal.valueOf(3600)));
    assertTrue(stakedScore.compareTo(unstakedScore) > 0);
  }

  @Test
  void shouldDropPlacementOnceTerminal() {
    exchange.seedReserve("alice", "USDT", 300);
    QueuePosition cancelled = join("alice", 100);
    QueuePosition filled = join("alice", 20);
    exchange.swapOrchestrator.cancelQueue(new CancelQueueCommand("alice", cancelled.id()));
    exchange.fund("carol", "USDC", micros(20));
    exchange.swapOrchestrator.deposit(new DepositCommand("carol", "USDC", micros(20)));

    PositionView cancelledView = queryService.position(cancelled.id());
    PositionView filledView = queryService.position(filled.id());

    assertEquals("CANCELLED", cancelledView.status());
    assertNull(cancelledView.positionNumber());
    assertNull(cancelledView.amountAhead());
    assertEquals("FILLED", filledView.status());
    assertEquals(dollars(20), filledView.filledAmount());
    assertEquals(BigDecimal.ZERO, filledView.fillScore());
    assertTrue(queryService.positionsOf("alice").isEmpty());
  }

  @Test
  void shouldListOpenPositionsOfOwnerOldestFirst() {
    exchange.seedReserve("alice", "USDC", 100);
    exchange.seedReserve("alice", "USDT", 100);
    QueuePosition first = join("alice", 10);
    QueuePosition second =
        exchange.swapOrchestrator.joinQueue(new JoinQueueCommand("alice", "USDT", dollars(5)));

    List<PositionView> positions = queryService.positionsOf("alice");

    assertEquals(
        List.of(first.id(), second.id()), positions.stream().map(PositionView::id).toList());
    assertTrue(queryService.positionsOf("bob").isEmpty());
  }

  @Test
  void shouldFailForUnknownPosition() {
    assertThrows(PositionNotFoundException.class, () -> queryService.position(42L));
  }

  @Test
  void shouldReportEmissionProgress() {
    exchange.engine.execute(
        "reward",
        events ->
            exchange.rewardService.rewardTaker(
                "carol", dollars(10_000), exchange.clock.instant(), events));

    EmissionStats stats = queryService.emissionStats();

    assertEquals(BigInteger.valueOf(100_000_000L), stats.takerMinted());
    assertEquals(stats.takerCap().subtract(stats.takerMinted()), stats.takerRemaining());
    assertEquals(BigInteger.valueOf(25_000_000L), stats.founderVested());
    assertEquals(BigInteger.valueOf(125_000_000L), stats.totalMinted());
    assertEquals(800, stats.makerAprBps());
  }

  private QueuePosition join(String owner, long wholeDollars) {
    return exchange.swapOrchestrator.joinQueue(
        new JoinQueueCommand(owner, "USDC", dollars(wholeDollars)));
  }
}
