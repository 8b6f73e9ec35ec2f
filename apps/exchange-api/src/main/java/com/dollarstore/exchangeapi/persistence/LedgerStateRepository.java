package com.dollarstore.exchangeapi.persistence;

import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.staking.DailyRedemption;
import com.dollarstore.domain.staking.StakeAccount;
import com.dollarstore.exchangeapi.token.TokenAllowance;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage behind the in-memory ledgers. Saves are upserts and join the caller's
 * transaction.
 */
public interface LedgerStateRepository {
  /** Next queue position id. Never returns the same value twice, even across restarts. */
  long nextQueuePositionId();

  Map<String, BigInteger> findReserveBalances();

  void saveReserveBalance(String asset, BigInteger balance);

  List<QueuePosition> findQueuePositions();

  void saveQueuePosition(QueuePosition position);

  List<StakeAccount> findStakeAccounts();

  void saveStakeAccount(StakeAccount account);

  List<DailyRedemption> findDailyRedemptions();

  void saveDailyRedemption(DailyRedemption redemption);

  Optional<EmissionTotals> findEmissionTotals();

  void saveEmissionTotals(EmissionTotals totals);

  Map<String, BigInteger> findTokenBalances(String symbol);

  void saveTokenBalance(String symbol, String account, BigInteger balance);

  List<TokenAllowance> findTokenAllowances(String symbol);

  void saveTokenAllowance(String symbol, TokenAllowance allowance);
}
