package com.dollarstore.exchangeapi.staking;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.staking.AlreadyUnstakingException;
import com.dollarstore.domain.staking.DailyRedemptionTracker;
import com.dollarstore.domain.staking.FeeFreeCapPolicy;
import com.dollarstore.domain.staking.StakeAccount;
import com.dollarstore.domain.staking.StakeLedger;
import com.dollarstore.domain.staking.StakeStatus;
import com.dollarstore.exchangeapi.config.ExchangeProperties;
import com.dollarstore.exchangeapi.engine.ExchangeEngine;
import com.dollarstore.exchangeapi.engine.ExchangeEvent;
import com.dollarstore.exchangeapi.token.TokenRegistry;
import com.dollarstore.infra.kafka.contract.EventTypes;
import com.dollarstore.infra.kafka.contract.payload.StakeUpdatedV1;
import com.dollarstore.infra.kafka.topics.TopicNames;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Service;

@Service
public class StakingService {
  private static final String AGGREGATE_TYPE = "STAKE_ACCOUNT";

  private final ExchangeEngine engine;
  private final StakeLedger stakeLedger;
  private final FeeFreeCapPolicy feeFreeCapPolicy;
  private final DailyRedemptionTracker redemptionTracker;
  private final TokenRegistry tokenRegistry;
  private final String custodyAccount;
  private final Clock clock;

  public StakingService(
      ExchangeEngine engine,
      StakeLedger stakeLedger,
      FeeFreeCapPolicy feeFreeCapPolicy,
      DailyRedemptionTracker redemptionTracker,
      TokenRegistry tokenRegistry,
      ExchangeProperties properties,
      Clock clock) {
    this.engine = engine;
    this.stakeLedger = stakeLedger;
    this.feeFreeCapPolicy = feeFreeCapPolicy;
    this.redemptionTracker = redemptionTracker;
    this.tokenRegistry = tokenRegistry;
    this.custodyAccount = properties.getCustodyAccount();
    this.clock = clock;
  }

  /** Pulls reward tokens from the owner's wallet into custody and adds them to the stake. */
  public StakeAccount stake(String owner, BigInteger amount) {
    return engine.execute(
        "stake",
        events -> {
          Amounts.requirePositive(amount, "amount");
          if (stakeLedger.account(owner).status() == StakeStatus.UNSTAKING) {
            throw new AlreadyUnstakingException(owner);
          }
          Instant now = clock.instant();
          tokenRegistry.reward().transferFrom(custodyAccount, owner, custodyAccount, amount);
          StakeAccount account = stakeLedger.stake(owner, amount, now);
          events.add(stakeEvent(EventTypes.STAKED, account, amount, now));
          return account;
        });
  }

  public StakeAccount unstake(String owner) {
    return engine.execute(
        "unstake",
        events -> {
          Instant now = clock.instant();
          StakeAccount account = stakeLedger.unstake(owner, now);
          events.add(
              stakeEvent(EventTypes.UNSTAKE_INITIATED, account, account.stakedAmount(), now));
          return account;
        });
  }

  /** Returns the released stake to the owner's wallet once the cooldown has passed. */
  public BigInteger completeUnstake(String owner) {
    return engine.execute(
        "complete_unstake",
        events -> {
          Instant now = clock.instant();
          BigInteger released = stakeLedger.completeUnstake(owner, now);
          tokenRegistry.reward().transfer(custodyAccount, owner, released);
          events.add(
              stakeEvent(
                  EventTypes.UNSTAKE_COMPLETED,
                  stakeLedger.account(owner),
                  released,
                  now));
          return released;
        });
  }

  public StakeAccount cancelUnstake(String owner) {
    return engine.execute(
        "cancel_unstake",
        events -> {
          Instant now = clock.instant();
          StakeAccount account = stakeLedger.cancelUnstake(owner, now);
          events.add(
              stakeEvent(EventTypes.UNSTAKE_CANCELLED, account, account.stakedAmount(), now));
          return account;
        });
  }

  public StakingInfo stakingInfo(String owner) {
    return engine.read(
        () -> {
          Instant now = clock.instant();
          StakeAccount account = stakeLedger.account(owner);
          BigInteger power = account.power(now, stakeLedger.policy());
          return new StakingInfo(
              account.owner(),
              account.status(),
              account.stakedAmount(),
              power,
              account.stakeStartedAt(),
              account.unstakeInitiatedAt(),
              account.unstakeAvailableAt(stakeLedger.policy()),
              account.timeUntilFullPower(now, stakeLedger.policy()),
              feeFreeCapPolicy.dailyCap(account, power),
              redemptionTracker.used(owner, now));
        });
  }

  private ExchangeEvent stakeEvent(
      String eventType, StakeAccount account, BigInteger amount, Instant now) {
    return new ExchangeEvent(
        AGGREGATE_TYPE,
        account.owner(),
        eventType,
        TopicNames.STAKING_ACCOUNTS_V1,
        new StakeUpdatedV1(
            account.owner(),
            account.status().name(),
            account.stakedAmount(),
            amount,
            account.power(now, stakeLedger.policy()),
            account.stakeStartedAt(),
            account.unstakeInitiatedAt(),
            account.unstakeAvailableAt(stakeLedger.policy()),
            now));
  }
}
