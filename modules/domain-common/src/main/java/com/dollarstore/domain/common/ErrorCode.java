package com.dollarstore.domain.common;

public enum ErrorCode {
  UNSUPPORTED_ASSET,
  ZERO_AMOUNT,
  INSUFFICIENT_RESERVES,
  INSUFFICIENT_ALLOWANCE,
  INSUFFICIENT_BALANCE,
  POSITION_NOT_FOUND,
  NOT_OWNER,
  ALREADY_UNSTAKING,
  NOT_STAKED,
  COOLDOWN_NOT_COMPLETE,
  NOT_UNSTAKING,
  SAME_ASSET_SWAP,
  INVALID_PRECISION,
  INVALID_TRANSITION;

  public String slug() {
    return name().toLowerCase().replace('_', '-');
  }
}
