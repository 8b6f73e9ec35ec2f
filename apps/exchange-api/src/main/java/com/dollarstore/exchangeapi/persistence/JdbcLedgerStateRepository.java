package com.dollarstore.exchangeapi.persistence;

import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.queue.QueueStatus;
import com.dollarstore.domain.staking.DailyRedemption;
import com.dollarstore.domain.staking.StakeAccount;
import com.dollarstore.domain.staking.StakeStatus;
import com.dollarstore.exchangeapi.token.TokenAllowance;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcLedgerStateRepository implements LedgerStateRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcLedgerStateRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long nextQueuePositionId() {
    Long id = jdbcTemplate.queryForObject("SELECT nextval('queue_position_id_seq')", Long.class);
    if (id == null) {
      throw new IllegalStateException("queue_position_id_seq returned no value");
    }
    return id;
  }

  @Override
  public Map<String, BigInteger> findReserveBalances() {
    Map<String, BigInteger> balances = new LinkedHashMap<>();
    jdbcTemplate.query(
        "SELECT asset, balance FROM reserve_balances ORDER BY asset",
        rs -> {
          balances.put(rs.getString("asset"), amount(rs, "balance"));
        });
    return balances;
  }

  @Override
  public void saveReserveBalance(String asset, BigInteger balance) {
    String sql =
        """
        INSERT INTO reserve_balances (asset, balance, updated_at)
        VALUES (?, ?, NOW())
        ON CONFLICT (asset) DO UPDATE
        SET balance = EXCLUDED.balance,
            updated_at = NOW()
        """;
    jdbcTemplate.update(sql, asset, new BigDecimal(balance));
  }

  @Override
  public List<QueuePosition> findQueuePositions() {
    String sql =
        """
        SELECT id,
               owner,
               asset,
               original_amount,
               remaining_amount,
               status,
               created_at,
               updated_at
        FROM queue_positions
        ORDER BY id
        """;
    return jdbcTemplate.query(sql, JdbcLedgerStateRepository::mapQueuePosition);
  }

  @Override
  public void saveQueuePosition(QueuePosition position) {
    String sql =
        """
        INSERT INTO queue_positions (
            id,
            owner,
            asset,
            original_amount,
            remaining_amount,
            status,
            created_at,
            updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (id) DO UPDATE
        SET remaining_amount = EXCLUDED.remaining_amount,
            status = EXCLUDED.status,
            updated_at = EXCLUDED.updated_at
        """;
    jdbcTemplate.update(
        sql,
        position.id(),
        position.owner(),
        position.asset(),
        new BigDecimal(position.originalAmount()),
        new BigDecimal(position.remainingAmount()),
        position.status().name(),
        Timestamp.from(position.createdAt()),
        Timestamp.from(position.updatedAt()));
  }

  @Override
  public List<StakeAccount> findStakeAccounts() {
    String sql =
        """
        SELECT owner, staked_amount, status, stake_started_at, unstake_initiated_at
        FROM stake_accounts
        ORDER BY owner
        """;
    return jdbcTemplate.query(sql, JdbcLedgerStateRepository::mapStakeAccount);
  }

  @Override
  public void saveStakeAccount(StakeAccount account) {
    String sql =
        """
        INSERT INTO stake_accounts (
            owner,
            staked_amount,
            status,
            stake_started_at,
            unstake_initiated_at
        ) VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (owner) DO UPDATE
        SET staked_amount = EXCLUDED.staked_amount,
            status = EXCLUDED.status,
            stake_started_at = EXCLUDED.stake_started_at,
            unstake_initiated_at = EXCLUDED.unstake_initiated_at
        """;
    jdbcTemplate.update(
        sql,
        account.owner(),
        new BigDecimal(account.stakedAmount()),
        account.status().name(),
        timestamp(account.stakeStartedAt()),
        timestamp(account.unstakeInitiatedAt()));
  }

  @Override
  public List<DailyRedemption> findDailyRedemptions() {
    return jdbcTemplate.query(
        "SELECT owner, redemption_day, used_amount FROM daily_redemptions",
        (rs, rowNum) ->
            new DailyRedemption(
                rs.getString("owner"),
                rs.getDate("redemption_day").toLocalDate(),
                amount(rs, "used_amount")));
  }

  @Override
  public void saveDailyRedemption(DailyRedemption redemption) {
    String sql =
        """
        INSERT INTO daily_redemptions (owner, redemption_day, used_amount)
        VALUES (?, ?, ?)
        ON CONFLICT (owner) DO UPDATE
        SET redemption_day = EXCLUDED.redemption_day,
            used_amount = EXCLUDED.used_amount
        """;
    jdbcTemplate.update(
        sql,
        redemption.owner(),
        Date.valueOf(redemption.day()),
        new BigDecimal(redemption.used()));
  }

  @Override
  public Optional<EmissionTotals> findEmissionTotals() {
    List<EmissionTotals> rows =
        jdbcTemplate.query(
            "SELECT maker_minted, taker_minted, founder_vested FROM emission_totals WHERE id = 1",
            (rs, rowNum) ->
                new EmissionTotals(
                    amount(rs, "maker_minted"),
                    amount(rs, "taker_minted"),
                    amount(rs, "founder_vested")));
    return rows.stream().findFirst();
  }

  @Override
  public void saveEmissionTotals(EmissionTotals totals) {
    String sql =
        """
        INSERT INTO emission_totals (id, maker_minted, taker_minted, founder_vested, updated_at)
        VALUES (1, ?, ?, ?, NOW())
        ON CONFLICT (id) DO UPDATE
        SET maker_minted = EXCLUDED.maker_minted,
            taker_minted = EXCLUDED.taker_minted,
            founder_vested = EXCLUDED.founder_vested,
            updated_at = NOW()
        """;
    jdbcTemplate.update(
        sql,
        new BigDecimal(totals.makerMinted()),
        new BigDecimal(totals.takerMinted()),
        new BigDecimal(totals.founderVested()));
  }

  @Override
  public Map<String, BigInteger> findTokenBalances(String symbol) {
    Map<String, BigInteger> balances = new LinkedHashMap<>();
    jdbcTemplate.query(
        "SELECT account, balance FROM token_balances WHERE symbol = ? ORDER BY account",
        rs -> {
          balances.put(rs.getString("account"), amount(rs, "balance"));
        },
        symbol);
    return balances;
  }

  @Override
  public void saveTokenBalance(String symbol, String account, BigInteger balance) {
    String sql =
        """
        INSERT INTO token_balances (symbol, account, balance)
        VALUES (?, ?, ?)
        ON CONFLICT (symbol, account) DO UPDATE
        SET balance = EXCLUDED.balance
        """;
    jdbcTemplate.update(sql, symbol, account, new BigDecimal(balance));
  }

  @Override
  public List<TokenAllowance> findTokenAllowances(String symbol) {
    return jdbcTemplate.query(
        "SELECT owner, spender, amount FROM token_allowances WHERE symbol = ?",
        (rs, rowNum) ->
            new TokenAllowance(
                rs.getString("owner"), rs.getString("spender"), amount(rs, "amount")),
        symbol);
  }

  @Override
  public void saveTokenAllowance(String symbol, TokenAllowance allowance) {
    String sql =
        """
        INSERT INTO token_allowances (symbol, owner, spender, amount)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (symbol, owner, spender) DO UPDATE
        SET amount = EXCLUDED.amount
        """;
    jdbcTemplate.update(
        sql,
        symbol,
        allowance.owner(),
        allowance.spender(),
        new BigDecimal(allowance.amount()));
  }

  private static QueuePosition mapQueuePosition(ResultSet rs, int rowNum) throws SQLException {
    return new QueuePosition(
        rs.getLong("id"),
        rs.getString("owner"),
        rs.getString("asset"),
        amount(rs, "original_amount"),
        amount(rs, "remaining_amount"),
        QueueStatus.valueOf(rs.getString("status")),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  private static StakeAccount mapStakeAccount(ResultSet rs, int rowNum) throws SQLException {
    return new StakeAccount(
        rs.getString("owner"),
        amount(rs, "staked_amount"),
        StakeStatus.valueOf(rs.getString("status")),
        instant(rs.getTimestamp("stake_started_at")),
        instant(rs.getTimestamp("unstake_initiated_at")));
  }

  private static BigInteger amount(ResultSet rs, String column) throws SQLException {
    return rs.getBigDecimal(column).toBigIntegerExact();
  }

  private static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant instant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
