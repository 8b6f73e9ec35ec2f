package com.dollarstore.exchangeapi.persistence;

import com.dollarstore.domain.emission.EmissionAllocator;
import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.queue.QueueStore;
import com.dollarstore.domain.reserve.ReserveLedger;
import com.dollarstore.domain.staking.DailyRedemption;
import com.dollarstore.domain.staking.DailyRedemptionTracker;
import com.dollarstore.domain.staking.StakeAccount;
import com.dollarstore.domain.staking.StakeLedger;
import com.dollarstore.exchangeapi.engine.StateJournal;
import com.dollarstore.exchangeapi.token.InMemoryTokenLedger;
import com.dollarstore.exchangeapi.token.TokenAllowance;
import com.dollarstore.exchangeapi.token.TokenLedger;
import com.dollarstore.exchangeapi.token.TokenRegistry;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the rows touched by an operation to {@link LedgerStateRepository} and reloads the stores
 * from it on startup. {@link #flush()} runs inside the operation's database transaction, so a
 * failed write rolls back both the rows and the in-memory stores.
 */
public class LedgerStatePersistence implements StateJournal {
  private static final Logger log = LoggerFactory.getLogger(LedgerStatePersistence.class);

  private final LedgerStateRepository repository;
  private final ReserveLedger reserveLedger;
  private final QueueStore queueStore;
  private final StakeLedger stakeLedger;
  private final DailyRedemptionTracker redemptionTracker;
  private final EmissionAllocator emissionAllocator;
  private final TokenLedger syntheticToken;
  private final List<InMemoryTokenLedger> tokenLedgers;

  public LedgerStatePersistence(
      LedgerStateRepository repository,
      ReserveLedger reserveLedger,
      QueueStore queueStore,
      StakeLedger stakeLedger,
      DailyRedemptionTracker redemptionTracker,
      EmissionAllocator emissionAllocator,
      TokenRegistry tokenRegistry) {
    this.repository = repository;
    this.reserveLedger = reserveLedger;
    this.queueStore = queueStore;
    this.stakeLedger = stakeLedger;
    this.redemptionTracker = redemptionTracker;
    this.emissionAllocator = emissionAllocator;
    this.syntheticToken = tokenRegistry.synthetic();
    this.tokenLedgers = new ArrayList<>();
    for (TokenLedger token : tokenRegistry.all()) {
      if (token instanceof InMemoryTokenLedger ledger) {
        tokenLedgers.add(ledger);
      }
    }
  }

  /** Loads every persisted row into the idle stores. */
  public void restore() {
    Map<String, BigInteger> reserves = repository.findReserveBalances();
    reserveLedger.restore(reserves);

    List<QueuePosition> positions = repository.findQueuePositions();
    positions.forEach(queueStore::restore);

    List<StakeAccount> stakes = repository.findStakeAccounts();
    stakes.forEach(stakeLedger::restore);

    List<DailyRedemption> redemptions = repository.findDailyRedemptions();
    redemptions.forEach(redemptionTracker::restore);

    repository
        .findEmissionTotals()
        .ifPresent(
            totals ->
                emissionAllocator.restoreMinted(
                    totals.makerMinted(), totals.takerMinted(), totals.founderVested()));

    int tokenRows = 0;
    for (InMemoryTokenLedger token : tokenLedgers) {
      Map<String, BigInteger> balances = repository.findTokenBalances(token.symbol());
      balances.forEach(token::restoreBalance);
      List<TokenAllowance> allowances = repository.findTokenAllowances(token.symbol());
      allowances.forEach(token::restoreAllowance);
      tokenRows += balances.size() + allowances.size();
    }

    log.info(
        "Restored ledger state reserves={} queuePositions={} stakes={} redemptions={} tokenRows={}",
        reserves.size(),
        positions.size(),
        stakes.size(),
        redemptions.size(),
        tokenRows);
    if (!reserveLedger.syntheticSupply().equals(syntheticToken.totalSupply())) {
      log.warn(
          "Restored reserves differ from synthetic token supply reserves={} tokenSupply={}",
          reserveLedger.totalReserves(),
          syntheticToken.totalSupply());
    }
  }

  @Override
  public void flush() {
    reserveLedger.changedBalances().forEach(repository::saveReserveBalance);
    queueStore.changedPositions().forEach(repository::saveQueuePosition);
    stakeLedger.changedAccounts().forEach(repository::saveStakeAccount);
    redemptionTracker.changedRedemptions().forEach(repository::saveDailyRedemption);
    emissionAllocator
        .changedState()
        .ifPresent(state -> repository.saveEmissionTotals(EmissionTotals.of(state)));
    for (InMemoryTokenLedger token : tokenLedgers) {
      token
          .changedBalances()
          .forEach(
              (account, balance) -> repository.saveTokenBalance(token.symbol(), account, balance));
      token
          .changedAllowances()
          .forEach(allowance -> repository.saveTokenAllowance(token.symbol(), allowance));
    }
  }
}
