package com.dollarstore.exchangeapi.swap;

import com.dollarstore.domain.common.Amounts;
import com.dollarstore.domain.queue.QueueFill;
import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.queue.QueueStore;
import com.dollarstore.domain.reserve.Asset;
import com.dollarstore.domain.reserve.AssetRegistry;
import com.dollarstore.domain.reserve.InsufficientReservesException;
import com.dollarstore.domain.reserve.ReserveLedger;
import com.dollarstore.domain.staking.DailyRedemptionTracker;
import com.dollarstore.exchangeapi.config.ExchangeProperties;
import com.dollarstore.exchangeapi.engine.EventCollector;
import com.dollarstore.exchangeapi.engine.ExchangeEngine;
import com.dollarstore.exchangeapi.engine.ExchangeEvent;
import com.dollarstore.exchangeapi.rewards.RewardService;
import com.dollarstore.exchangeapi.token.TokenLedger;
import com.dollarstore.exchangeapi.token.TokenRegistry;
import com.dollarstore.infra.kafka.contract.EventTypes;
import com.dollarstore.infra.kafka.contract.payload.DepositedV1;
import com.dollarstore.infra.kafka.contract.payload.QueueCancelledV1;
import com.dollarstore.infra.kafka.contract.payload.QueueFilledV1;
import com.dollarstore.infra.kafka.contract.payload.QueueJoinedV1;
import com.dollarstore.infra.kafka.contract.payload.WithdrawnV1;
import com.dollarstore.infra.kafka.topics.TopicNames;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Moves value between caller wallets, the custody account and the reserve. Queued synthetic
 * tokens stay in custody as escrow until their position is filled or cancelled, so they remain
 * part of the backed supply.
 */
@Service
public class SwapOrchestrator {
  private static final String RESERVE_AGGREGATE = "RESERVE";
  private static final String POSITION_AGGREGATE = "QUEUE_POSITION";

  private final ExchangeEngine engine;
  private final AssetRegistry assetRegistry;
  private final ReserveLedger reserveLedger;
  private final QueueStore queueStore;
  private final DailyRedemptionTracker redemptionTracker;
  private final TokenRegistry tokenRegistry;
  private final RewardService rewardService;
  private final String custodyAccount;
  private final Clock clock;

  public SwapOrchestrator(
      ExchangeEngine engine,
      AssetRegistry assetRegistry,
      ReserveLedger reserveLedger,
      QueueStore queueStore,
      DailyRedemptionTracker redemptionTracker,
      TokenRegistry tokenRegistry,
      RewardService rewardService,
      ExchangeProperties properties,
      Clock clock) {
    this.engine = engine;
    this.assetRegistry = assetRegistry;
    this.reserveLedger = reserveLedger;
    this.queueStore = queueStore;
    this.redemptionTracker = redemptionTracker;
    this.tokenRegistry = tokenRegistry;
    this.rewardService = rewardService;
    this.custodyAccount = properties.getCustodyAccount();
    this.clock = clock;
  }

  public DepositResult deposit(DepositCommand command) {
    return engine.execute(
        "deposit",
        events ->
            depositLeg(
                command.owner(),
                assetRegistry.require(command.asset()),
                command.amount(),
                clock.instant(),
                events));
  }

  public WithdrawResult withdraw(WithdrawCommand command) {
    return engine.execute(
        "withdraw",
        events -> {
          Asset asset = assetRegistry.require(command.asset());
          Amounts.requirePositive(command.amount(), "amount");
          BigInteger canonical = asset.normalize(command.amount());
          BigInteger received =
              withdrawLeg(command.owner(), asset, canonical, "WITHDRAW", clock.instant(), events);
          return new WithdrawResult(canonical, received);
        });
  }

  public SwapResult swap(SwapCommand command) {
    return engine.execute(
        "swap",
        events -> {
          Asset from = assetRegistry.require(command.fromAsset());
          Asset to = assetRegistry.require(command.toAsset());
          if (from.symbol().equals(to.symbol())) {
            throw new SameAssetSwapException(from.symbol());
          }
          Amounts.requirePositive(command.amount(), "amount");
          BigInteger canonical = from.normalize(command.amount());
          to.denormalize(canonical);

          Instant now = clock.instant();
          DepositResult deposit = depositLeg(command.owner(), from, command.amount(), now, events);
          return redeem(
              command.owner(), to, deposit.minted(), command.queueIfUnavailable(), now, events);
        });
  }

  public SwapResult swapFromSynthetic(SyntheticSwapCommand command) {
    return engine.execute(
        "swap_from_synthetic",
        events -> {
          Asset to = assetRegistry.require(command.toAsset());
          Amounts.requirePositive(command.amount(), "amount");
          to.denormalize(command.amount());
          return redeem(
              command.owner(),
              to,
              command.amount(),
              command.queueIfUnavailable(),
              clock.instant(),
              events);
        });
  }

  public QueuePosition joinQueue(JoinQueueCommand command) {
    return engine.execute(
        "join_queue",
        events -> {
          Asset asset = assetRegistry.require(command.asset());
          Amounts.requirePositive(command.amount(), "amount");
          asset.denormalize(command.amount());
          return enqueueEscrowed(command.owner(), asset, command.amount(), clock.instant(), events);
        });
  }

  /** Cancels an open position and returns its unfilled escrow to the caller. */
  public QueuePosition cancelQueue(CancelQueueCommand command) {
    return engine.execute(
        "cancel_queue",
        events -> {
          Instant now = clock.instant();
          QueuePosition cancelled =
              queueStore.cancel(command.positionId(), command.caller(), now);
          BigInteger refund = cancelled.remainingAmount();
          if (refund.signum() > 0) {
            tokenRegistry.synthetic().transfer(custodyAccount, cancelled.owner(), refund);
          }
          events.add(
              new ExchangeEvent(
                  POSITION_AGGREGATE,
                  Long.toString(cancelled.id()),
                  EventTypes.QUEUE_CANCELLED,
                  TopicNames.QUEUE_POSITIONS_V1,
                  new QueueCancelledV1(
                      cancelled.id(), cancelled.owner(), cancelled.asset(), refund, now)));
          return cancelled;
        });
  }

  private DepositResult depositLeg(
      String owner, Asset asset, BigInteger nativeAmount, Instant now, EventCollector events) {
    Amounts.requirePositive(nativeAmount, "amount");
    BigInteger canonical = asset.normalize(nativeAmount);

    tokenRegistry
        .require(asset.symbol())
        .transferFrom(custodyAccount, owner, custodyAccount, nativeAmount);
    reserveLedger.credit(asset.symbol(), canonical);
    tokenRegistry.synthetic().mint(owner, canonical);
    events.add(
        new ExchangeEvent(
            RESERVE_AGGREGATE,
            owner,
            EventTypes.DEPOSITED,
            TopicNames.RESERVE_DEPOSITS_V1,
            new DepositedV1(owner, asset.symbol(), nativeAmount, canonical, now)));

    List<QueueFill> fills = queueStore.drain(asset.symbol(), canonical, now);
    BigInteger cleared = BigInteger.ZERO;
    for (QueueFill fill : fills) {
      settleFill(asset, fill, now, events);
      cleared = cleared.add(fill.filledAmount());
    }
    BigInteger takerReward = rewardService.rewardTaker(owner, cleared, now, events);
    return new DepositResult(canonical, fills, takerReward);
  }

  /** Pays a queue fill out of escrow as a withdrawal on the position owner's behalf. */
  private void settleFill(Asset asset, QueueFill fill, Instant now, EventCollector events) {
    BigInteger nativeAmount = asset.denormalize(fill.filledAmount());
    tokenRegistry.synthetic().burn(custodyAccount, fill.filledAmount());
    reserveLedger.debit(asset.symbol(), fill.filledAmount());
    tokenRegistry.require(asset.symbol()).transfer(custodyAccount, fill.owner(), nativeAmount);
    events.add(
        new ExchangeEvent(
            POSITION_AGGREGATE,
            Long.toString(fill.positionId()),
            EventTypes.QUEUE_FILLED,
            TopicNames.QUEUE_POSITIONS_V1,
            new QueueFilledV1(
                fill.positionId(),
                fill.owner(),
                fill.asset(),
                fill.filledAmount(),
                fill.remainingAmount(),
                fill.statusAfter().name(),
                now)));
    rewardService.rewardMaker(fill, now, events);
  }

  private SwapResult redeem(
      String owner,
      Asset to,
      BigInteger canonical,
      boolean queueIfUnavailable,
      Instant now,
      EventCollector events) {
    BigInteger available = reserveLedger.balanceOf(to.symbol());
    if (available.compareTo(canonical) >= 0) {
      BigInteger received = withdrawLeg(owner, to, canonical, "SWAP", now, events);
      return new SwapResult(received, null, BigInteger.ZERO);
    }
    if (!queueIfUnavailable) {
      throw new InsufficientReservesException(to.symbol(), canonical, available);
    }
    BigInteger received = BigInteger.ZERO;
    if (available.signum() > 0) {
      received = withdrawLeg(owner, to, available, "SWAP", now, events);
    }
    BigInteger shortfall = canonical.subtract(available);
    QueuePosition position = enqueueEscrowed(owner, to, shortfall, now, events);
    return new SwapResult(received, position.id(), shortfall);
  }

  private BigInteger withdrawLeg(
      String owner,
      Asset asset,
      BigInteger canonical,
      String reason,
      Instant now,
      EventCollector events) {
    BigInteger nativeAmount = asset.denormalize(canonical);
    TokenLedger synthetic = tokenRegistry.synthetic();

    reserveLedger.debit(asset.symbol(), canonical);
    synthetic.burn(owner, canonical);
    tokenRegistry.require(asset.symbol()).transfer(custodyAccount, owner, nativeAmount);
    redemptionTracker.record(owner, canonical, now);
    events.add(
        new ExchangeEvent(
            RESERVE_AGGREGATE,
            owner,
            EventTypes.WITHDRAWN,
            TopicNames.RESERVE_WITHDRAWALS_V1,
            new WithdrawnV1(owner, asset.symbol(), nativeAmount, canonical, reason, now)));
    return nativeAmount;
  }

  private QueuePosition enqueueEscrowed(
      String owner, Asset asset, BigInteger canonical, Instant now, EventCollector events) {
    tokenRegistry.synthetic().transfer(owner, custodyAccount, canonical);
    QueuePosition position = queueStore.enqueue(asset.symbol(), canonical, owner, now);
    events.add(
        new ExchangeEvent(
            POSITION_AGGREGATE,
            Long.toString(position.id()),
            EventTypes.QUEUE_JOINED,
            TopicNames.QUEUE_POSITIONS_V1,
            new QueueJoinedV1(position.id(), owner, asset.symbol(), canonical, now)));
    return position;
  }
}
