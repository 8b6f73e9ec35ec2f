package com.dollarstore.exchangeapi.reconciliation;

import com.dollarstore.domain.reserve.Asset;
import com.dollarstore.domain.reserve.AssetRegistry;
import com.dollarstore.domain.reserve.ReserveLedger;
import com.dollarstore.exchangeapi.config.ExchangeProperties;
import com.dollarstore.exchangeapi.engine.ExchangeEngine;
import com.dollarstore.exchangeapi.token.TokenRegistry;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/** Checks the reserve ledger against what the custody account actually holds. */
@Service
public class ReserveReconciliationService {
  private final ExchangeEngine engine;
  private final AssetRegistry assetRegistry;
  private final ReserveLedger reserveLedger;
  private final TokenRegistry tokenRegistry;
  private final ReconciliationReporter reporter;
  private final String custodyAccount;
  private final Clock clock;

  public ReserveReconciliationService(
      ExchangeEngine engine,
      AssetRegistry assetRegistry,
      ReserveLedger reserveLedger,
      TokenRegistry tokenRegistry,
      ReconciliationReporter reporter,
      ExchangeProperties properties,
      Clock clock) {
    this.engine = engine;
    this.assetRegistry = assetRegistry;
    this.reserveLedger = reserveLedger;
    this.tokenRegistry = tokenRegistry;
    this.reporter = reporter;
    this.custodyAccount = properties.getCustodyAccount();
    this.clock = clock;
  }

  public ReconciliationResult runOnce() {
    Instant startedAt = clock.instant();
    ReconciliationResult result =
        engine.read(
            () -> {
              Map<String, BigInteger> drift = new LinkedHashMap<>();
              for (Asset asset : assetRegistry.all()) {
                BigInteger held = tokenRegistry.require(asset.symbol()).balanceOf(custodyAccount);
                BigInteger ledger = reserveLedger.balanceOf(asset.symbol());
                drift.put(asset.symbol(), ledger.subtract(asset.normalize(held)));
              }
              BigInteger supplyDrift =
                  reserveLedger.syntheticSupply().subtract(tokenRegistry.synthetic().totalSupply());
              boolean matched =
                  supplyDrift.signum() == 0
                      && drift.values().stream().allMatch(value -> value.signum() == 0);
              return new ReconciliationResult(
                  startedAt,
                  clock.instant(),
                  matched ? ReconciliationStatus.MATCHED : ReconciliationStatus.DRIFT_DETECTED,
                  Collections.unmodifiableMap(drift),
                  supplyDrift);
            });
    reporter.report(result);
    return result;
  }
}
