package com.dollarstore.exchangeapi.rewards;

import com.dollarstore.domain.emission.EmissionAllocator;
import com.dollarstore.domain.emission.EmissionCategory;
import com.dollarstore.domain.emission.EmissionGrant;
import com.dollarstore.domain.emission.RewardMath;
import com.dollarstore.domain.queue.QueueFill;
import com.dollarstore.exchangeapi.engine.EventCollector;
import com.dollarstore.exchangeapi.engine.ExchangeEvent;
import com.dollarstore.exchangeapi.token.TokenRegistry;
import com.dollarstore.infra.kafka.contract.EventTypes;
import com.dollarstore.infra.kafka.contract.payload.RewardMintedV1;
import com.dollarstore.infra.kafka.topics.TopicNames;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Mints reward tokens for queue activity. Must be called inside an engine operation; the amounts
 * are clipped by the emission caps and the founder share vests alongside every user mint.
 */
@Service
public class RewardService {
  static final String AGGREGATE_TYPE = "EMISSION";

  private final EmissionAllocator emissionAllocator;
  private final TokenRegistry tokenRegistry;

  public RewardService(EmissionAllocator emissionAllocator, TokenRegistry tokenRegistry) {
    this.emissionAllocator = emissionAllocator;
    this.tokenRegistry = tokenRegistry;
  }

  /** Rewards the owner of a filled position for the time the filled amount spent queued. */
  public BigInteger rewardMaker(QueueFill fill, Instant now, EventCollector events) {
    Duration waited = Duration.between(fill.enqueuedAt(), now);
    BigInteger reward =
        RewardMath.makerReward(fill.filledAmount(), waited, emissionAllocator.schedule());
    return mint(emissionAllocator.mintMaker(fill.owner(), reward), now, events);
  }

  /** Rewards the depositor whose deposit cleared {@code clearedAmount} of queued redemptions. */
  public BigInteger rewardTaker(
      String taker, BigInteger clearedAmount, Instant now, EventCollector events) {
    BigInteger reward = RewardMath.takerReward(clearedAmount, emissionAllocator.schedule());
    return mint(emissionAllocator.mintTaker(taker, reward), now, events);
  }

  private BigInteger mint(List<EmissionGrant> grants, Instant now, EventCollector events) {
    BigInteger userGranted = BigInteger.ZERO;
    for (EmissionGrant grant : grants) {
      if (grant.granted().signum() <= 0) {
        continue;
      }
      tokenRegistry.reward().mint(grant.recipient(), grant.granted());
      events.add(
          new ExchangeEvent(
              AGGREGATE_TYPE,
              grant.recipient(),
              EventTypes.REWARD_MINTED,
              TopicNames.EMISSIONS_REWARDS_V1,
              new RewardMintedV1(
                  grant.recipient(),
                  grant.category().name(),
                  grant.requested(),
                  grant.granted(),
                  now)));
      if (grant.category() != EmissionCategory.FOUNDER) {
        userGranted = userGranted.add(grant.granted());
      }
    }
    return userGranted;
  }
}
