package com.dollarstore.domain.staking;

import java.math.BigInteger;

/** Maps stake power to the synthetic amount an account may redeem per day without a fee. */
public interface FeeFreeCapPolicy {
  BigInteger dailyCap(StakeAccount account, BigInteger power);
}
