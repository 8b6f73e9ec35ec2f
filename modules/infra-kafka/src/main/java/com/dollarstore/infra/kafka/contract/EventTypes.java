package com.dollarstore.infra.kafka.contract;

public final class EventTypes {
  public static final String DEPOSITED = "Deposited";
  public static final String WITHDRAWN = "Withdrawn";
  public static final String QUEUE_JOINED = "QueueJoined";
  public static final String QUEUE_FILLED = "QueueFilled";
  public static final String QUEUE_CANCELLED = "QueueCancelled";
  public static final String STAKED = "Staked";
  public static final String UNSTAKE_INITIATED = "UnstakeInitiated";
  public static final String UNSTAKE_COMPLETED = "UnstakeCompleted";
  public static final String UNSTAKE_CANCELLED = "UnstakeCancelled";
  public static final String REWARD_MINTED = "RewardMinted";

  private EventTypes() {}
}
