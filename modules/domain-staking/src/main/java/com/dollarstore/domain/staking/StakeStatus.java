package com.dollarstore.domain.staking;

public enum StakeStatus {
  NONE,
  STAKED,
  UNSTAKING
}
