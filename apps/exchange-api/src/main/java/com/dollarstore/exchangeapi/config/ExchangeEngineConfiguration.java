package com.dollarstore.exchangeapi.config;

import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.domain.emission.EmissionAllocator;
import com.dollarstore.domain.emission.EmissionSchedule;
import com.dollarstore.domain.emission.EmissionState;
import com.dollarstore.domain.queue.QueueStore;
import com.dollarstore.domain.reserve.Asset;
import com.dollarstore.domain.reserve.AssetRegistry;
import com.dollarstore.domain.reserve.ReserveLedger;
import com.dollarstore.domain.staking.DailyRedemptionTracker;
import com.dollarstore.domain.staking.FeeFreeCapPolicy;
import com.dollarstore.domain.staking.LinearFeeFreeCapPolicy;
import com.dollarstore.domain.staking.StakeLedger;
import com.dollarstore.domain.staking.StakingPolicy;
import com.dollarstore.exchangeapi.engine.ExchangeEngine;
import com.dollarstore.exchangeapi.outbox.OutboxAppendRepository;
import com.dollarstore.exchangeapi.persistence.LedgerStatePersistence;
import com.dollarstore.exchangeapi.persistence.LedgerStateRepository;
import com.dollarstore.exchangeapi.token.InMemoryTokenLedger;
import com.dollarstore.exchangeapi.token.TokenLedger;
import com.dollarstore.exchangeapi.token.TokenRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionOperations;

/** Wires the in-memory stores, their persistence and the engine that owns them. */
@Configuration
@EnableConfigurationProperties(ExchangeProperties.class)
public class ExchangeEngineConfiguration {
  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AssetRegistry assetRegistry(ExchangeProperties properties) {
    return new AssetRegistry(
        properties.getAssets().stream()
            .map(spec -> new Asset(spec.getSymbol(), spec.getDecimals(), spec.isSupported()))
            .toList());
  }

  @Bean
  public ReserveLedger reserveLedger(AssetRegistry assetRegistry) {
    return new ReserveLedger(assetRegistry);
  }

  @Bean
  public QueueStore queueStore(LedgerStateRepository ledgerStateRepository) {
    return new QueueStore(ledgerStateRepository::nextQueuePositionId);
  }

  @Bean
  public StakeLedger stakeLedger(ExchangeProperties properties) {
    ExchangeProperties.Staking staking = properties.getStaking();
    return new StakeLedger(
        new StakingPolicy(staking.getFullPowerDuration(), staking.getUnstakeCooldown()));
  }

  @Bean
  public DailyRedemptionTracker dailyRedemptionTracker() {
    return new DailyRedemptionTracker();
  }

  @Bean
  @ConditionalOnMissingBean
  public FeeFreeCapPolicy feeFreeCapPolicy(ExchangeProperties properties) {
    return new LinearFeeFreeCapPolicy(
        properties.getRewardToken().getDecimals(),
        properties.getStaking().getFeeFreeCapMultiplierBps());
  }

  @Bean
  public EmissionAllocator emissionAllocator(ExchangeProperties properties) {
    ExchangeProperties.Emission emission = properties.getEmission();
    return new EmissionAllocator(
        EmissionState.withCaps(
            emission.getMakerCap(), emission.getTakerCap(), emission.getFounderCap()),
        new EmissionSchedule(
            emission.getMakerAprBps(),
            emission.getTakerFeeBps(),
            emission.getRewardUnitsPerDollar(),
            emission.getFounderShareDivisor()),
        properties.getFounderAccount());
  }

  @Bean
  public TokenRegistry tokenRegistry(ExchangeProperties properties) {
    List<TokenLedger> assetTokens = new ArrayList<>();
    for (ExchangeProperties.AssetSpec spec : properties.getAssets()) {
      assetTokens.add(inMemoryToken(spec));
    }
    return new TokenRegistry(
        inMemoryToken(properties.getSyntheticToken()),
        inMemoryToken(properties.getRewardToken()),
        assetTokens);
  }

  @Bean
  public LedgerStatePersistence ledgerStatePersistence(
      LedgerStateRepository ledgerStateRepository,
      ReserveLedger reserveLedger,
      QueueStore queueStore,
      StakeLedger stakeLedger,
      DailyRedemptionTracker dailyRedemptionTracker,
      EmissionAllocator emissionAllocator,
      TokenRegistry tokenRegistry) {
    return new LedgerStatePersistence(
        ledgerStateRepository,
        reserveLedger,
        queueStore,
        stakeLedger,
        dailyRedemptionTracker,
        emissionAllocator,
        tokenRegistry);
  }

  /** Restores persisted state before the engine accepts its first operation. */
  @Bean
  public ExchangeEngine exchangeEngine(
      ReserveLedger reserveLedger,
      QueueStore queueStore,
      StakeLedger stakeLedger,
      DailyRedemptionTracker dailyRedemptionTracker,
      EmissionAllocator emissionAllocator,
      TokenRegistry tokenRegistry,
      LedgerStatePersistence ledgerStatePersistence,
      OutboxAppendRepository outboxAppendRepository,
      TransactionOperations transactionOperations,
      MeterRegistry meterRegistry) {
    List<TransactionalStore> stores = new ArrayList<>();
    stores.add(reserveLedger);
    stores.add(queueStore);
    stores.add(stakeLedger);
    stores.add(dailyRedemptionTracker);
    stores.add(emissionAllocator);
    for (TokenLedger token : tokenRegistry.all()) {
      if (token instanceof TransactionalStore store) {
        stores.add(store);
      }
    }
    ledgerStatePersistence.restore();
    return new ExchangeEngine(
        stores,
        ledgerStatePersistence,
        outboxAppendRepository,
        transactionOperations,
        meterRegistry);
  }

  private static TokenLedger inMemoryToken(ExchangeProperties.TokenSpec spec) {
    return new InMemoryTokenLedger(spec.getSymbol(), spec.getDecimals());
  }
}
