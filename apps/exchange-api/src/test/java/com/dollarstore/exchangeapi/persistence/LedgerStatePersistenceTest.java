package com.dollarstore.exchangeapi.persistence;

import static com.dollarstore.exchangeapi.ExchangeFixture.CUSTODY;
import static com.dollarstore.exchangeapi.ExchangeFixture.dollars;
import static com.dollarstore.exchangeapi.ExchangeFixture.micros;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.queue.QueueStatus;
import com.dollarstore.domain.staking.StakeStatus;
import com.dollarstore.exchangeapi.ExchangeFixture;
import com.dollarstore.exchangeapi.reconciliation.ReconciliationStatus;
import com.dollarstore.exchangeapi.swap.JoinQueueCommand;
import com.dollarstore.exchangeapi.swap.WithdrawCommand;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class LedgerStatePersistenceTest {
  @Test
  void shouldResumeExchangeFromRepositoryAfterRestart() {
    InMemoryLedgerStateRepository repository = new InMemoryLedgerStateRepository();
    ExchangeFixture before = new ExchangeFixture(repository);
    before.seedReserve("alice", "USDC", 1_000);
    QueuePosition queued =
        before.swapOrchestrator.joinQueue(new JoinQueueCommand("alice", "USDT", dollars(300)));
    before.seedReserve("bob", "USDT", 100);
    before.fund("bob", "CENTS", micros(500));
    before.stakingService.stake("bob", micros(200));

    ExchangeFixture after = new ExchangeFixture(repository);

    assertEquals(dollars(1_000), after.reserveLedger.balanceOf("USDC"));
    assertEquals(before.reserveLedger.balanceOf("USDT"), after.reserveLedger.balanceOf("USDT"));
    assertEquals(before.syntheticSupply(), after.syntheticSupply());
    assertEquals(before.reserveLedger.syntheticSupply(), after.reserveLedger.syntheticSupply());
    assertEquals(dollars(200), after.queueStore.depth("USDT"));
    QueuePosition restored = after.queueStore.find(queued.id()).orElseThrow();
    assertEquals(QueueStatus.PARTIALLY_FILLED, restored.status());
    assertEquals(dollars(200), restored.remainingAmount());
    assertEquals(before.balance("DLRS", CUSTODY), after.balance("DLRS", CUSTODY));
    assertEquals(before.balance("CENTS", "bob"), after.balance("CENTS", "bob"));
    assertEquals(
        before.tokenRegistry.require("USDC").allowance("alice", CUSTODY),
        after.tokenRegistry.require("USDC").allowance("alice", CUSTODY));
    assertEquals(StakeStatus.STAKED, after.stakeLedger.account("bob").status());
    assertEquals(micros(200), after.stakeLedger.totalStaked());
    assertEquals(before.emissionAllocator.state(), after.emissionAllocator.state());
    assertEquals(ReconciliationStatus.MATCHED, after.reconciliationService.runOnce().status());

    QueuePosition next =
        after.swapOrchestrator.joinQueue(new JoinQueueCommand("alice", "USDT", dollars(1)));
    assertTrue(next.id() > queued.id());
  }

  @Test
  void shouldWriteOnlyRowsTouchedByOperation() {
    InMemoryLedgerStateRepository repository = spy(new InMemoryLedgerStateRepository());
    ExchangeFixture exchange = new ExchangeFixture(repository);
    exchange.seedReserve("alice", "USDC", 100);
    clearInvocations(repository);

    exchange.swapOrchestrator.withdraw(new WithdrawCommand("alice", "USDC", dollars(40)));

    verify(repository).saveReserveBalance("USDC", exchange.reserveLedger.balanceOf("USDC"));
    verify(repository).saveTokenBalance("DLRS", "alice", exchange.balance("DLRS", "alice"));
    verify(repository).saveTokenBalance(eq("USDC"), eq("alice"), any(BigInteger.class));
    verify(repository, never()).saveQueuePosition(any());
    verify(repository, never()).saveStakeAccount(any());
    verify(repository, never()).saveTokenAllowance(any(), any());
  }

  @Test
  void shouldLeaveLedgersUntouchedWhenWriteFails() {
    InMemoryLedgerStateRepository repository = spy(new InMemoryLedgerStateRepository());
    ExchangeFixture exchange = new ExchangeFixture(repository);
    exchange.seedReserve("alice", "USDC", 100);
    doThrow(new DataAccessResourceFailureException("connection lost"))
        .when(repository)
        .saveQueuePosition(any());

    assertThrows(
        DataAccessResourceFailureException.class,
        () ->
            exchange.swapOrchestrator.joinQueue(
                new JoinQueueCommand("alice", "USDT", dollars(30))));

    assertEquals(dollars(100), exchange.balance("DLRS", "alice"));
    assertEquals(BigInteger.ZERO, exchange.queueStore.depth("USDT"));
    assertEquals(dollars(100), repository.findTokenBalances("DLRS").get("alice"));
    assertTrue(repository.findQueuePositions().isEmpty());

    reset(repository);
    QueuePosition joined =
        exchange.swapOrchestrator.joinQueue(new JoinQueueCommand("alice", "USDT", dollars(30)));
    assertEquals(2L, joined.id());
    assertEquals(dollars(30), exchange.queueStore.depth("USDT"));
  }
}
