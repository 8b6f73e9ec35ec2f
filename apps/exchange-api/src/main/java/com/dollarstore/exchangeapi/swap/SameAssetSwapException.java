package com.dollarstore.exchangeapi.swap;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;

public class SameAssetSwapException extends ExchangeDomainException {
  public SameAssetSwapException(String asset) {
    super(ErrorCode.SAME_ASSET_SWAP, "Cannot swap " + asset + " for itself");
  }
}
