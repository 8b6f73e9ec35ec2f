package com.dollarstore.exchangeapi.query;

import com.dollarstore.domain.emission.EmissionAllocator;
import com.dollarstore.domain.emission.EmissionState;
import com.dollarstore.domain.emission.RewardMath;
import com.dollarstore.domain.queue.PositionNotFoundException;
import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.queue.QueuePositionInfo;
import com.dollarstore.domain.queue.QueueStore;
import com.dollarstore.domain.reserve.Asset;
import com.dollarstore.domain.reserve.AssetRegistry;
import com.dollarstore.domain.reserve.ReserveLedger;
import com.dollarstore.domain.staking.StakeLedger;
import com.dollarstore.exchangeapi.engine.ExchangeEngine;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class ExchangeQueryService {
  private final ExchangeEngine engine;
  private final AssetRegistry assetRegistry;
  private final ReserveLedger reserveLedger;
  private final QueueStore queueStore;
  private final StakeLedger stakeLedger;
  private final EmissionAllocator emissionAllocator;
  private final Clock clock;

  public ExchangeQueryService(
      ExchangeEngine engine,
      AssetRegistry assetRegistry,
      ReserveLedger reserveLedger,
      QueueStore queueStore,
      StakeLedger stakeLedger,
      EmissionAllocator emissionAllocator,
      Clock clock) {
    this.engine = engine;
    this.assetRegistry = assetRegistry;
    this.reserveLedger = reserveLedger;
    this.queueStore = queueStore;
    this.stakeLedger = stakeLedger;
    this.emissionAllocator = emissionAllocator;
    this.clock = clock;
  }

  public ReserveSummary reserves() {
    return engine.read(
        () -> {
          List<ReserveView> views = assetRegistry.all().stream().map(this::reserveView).toList();
          return new ReserveSummary(
              views,
              reserveLedger.totalReserves(),
              reserveLedger.syntheticSupply(),
              reserveLedger.isFullyBacked());
        });
  }

  public ReserveView reserve(String asset) {
    return engine.read(() -> reserveView(assetRegistry.require(asset)));
  }

  public BigInteger queueDepth(String asset) {
    return engine.read(() -> queueStore.depth(assetRegistry.require(asset).symbol()));
  }

  public PositionView position(long positionId) {
    return engine.read(
        () -> {
          QueuePosition position =
              queueStore
                  .find(positionId)
                  .orElseThrow(() -> new PositionNotFoundException(positionId));
          return view(position, clock.instant());
        });
  }

  /** Open positions of {@code owner} across all assets, oldest first. */
  public List<PositionView> positionsOf(String owner) {
    return engine.read(
        () -> {
          Instant now = clock.instant();
          return queueStore.positionsOf(owner).stream()
              .map(position -> view(position, now))
              .toList();
        });
  }

  public EmissionStats emissionStats() {
    return engine.read(
        () -> {
          EmissionState state = emissionAllocator.state();
          return new EmissionStats(
              state.makerCap(),
              state.makerMinted(),
              state.makerRemaining(),
              state.takerCap(),
              state.takerMinted(),
              state.takerRemaining(),
              state.founderCap(),
              state.founderVested(),
              state.founderRemaining(),
              state.totalMinted(),
              emissionAllocator.schedule().makerAprBps(),
              emissionAllocator.schedule().takerFeeBps());
        });
  }

  private ReserveView reserveView(Asset asset) {
    BigInteger balance = reserveLedger.balanceOf(asset.symbol());
    return new ReserveView(
        asset.symbol(),
        asset.decimals(),
        asset.supported(),
        balance,
        asset.denormalize(balance),
        queueStore.depth(asset.symbol()));
  }

  private PositionView view(QueuePosition position, Instant now) {
    if (!position.isOpen()) {
      return PositionView.of(position, null, BigDecimal.ZERO);
    }
    QueuePositionInfo info = queueStore.positionInfo(position.id());
    BigInteger power = stakeLedger.power(position.owner(), now);
    long secondsInQueue = Duration.between(position.createdAt(), now).getSeconds();
    BigDecimal fillScore =
        RewardMath.fillScore(power, position.remainingAmount(), secondsInQueue);
    return PositionView.of(position, info, fillScore);
  }
}
