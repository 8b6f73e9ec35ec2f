package com.dollarstore.domain.reserve;

import com.dollarstore.domain.common.ErrorCode;
import com.dollarstore.domain.common.ExchangeDomainException;

public class UnsupportedAssetException extends ExchangeDomainException {
  private final String asset;

  public UnsupportedAssetException(String asset) {
    super(ErrorCode.UNSUPPORTED_ASSET, "Asset is not supported: " + asset);
    this.asset = asset;
  }

  public String asset() {
    return asset;
  }
}
