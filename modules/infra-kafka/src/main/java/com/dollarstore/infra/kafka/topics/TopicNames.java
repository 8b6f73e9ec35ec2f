package com.dollarstore.infra.kafka.topics;

import java.util.List;

public final class TopicNames {
  public static final String RESERVE_DEPOSITS_V1 = "reserve.deposits.v1";
  public static final String RESERVE_WITHDRAWALS_V1 = "reserve.withdrawals.v1";
  public static final String QUEUE_POSITIONS_V1 = "queue.positions.v1";
  public static final String STAKING_ACCOUNTS_V1 = "staking.accounts.v1";
  public static final String EMISSIONS_REWARDS_V1 = "emissions.rewards.v1";

  private TopicNames() {}

  public static List<String> all() {
    return List.of(
        RESERVE_DEPOSITS_V1,
        RESERVE_WITHDRAWALS_V1,
        QUEUE_POSITIONS_V1,
        STAKING_ACCOUNTS_V1,
        EMISSIONS_REWARDS_V1);
  }
}
