package com.dollarstore.exchangeapi.reconciliation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingReconciliationReporter implements ReconciliationReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingReconciliationReporter.class);

  @Override
  public void report(ReconciliationResult result) {
    if (result.status() == ReconciliationStatus.MATCHED) {
      log.info(
          "Reserve reconciliation status={} assets={}",
          result.status(),
          result.driftByAsset().size());
      return;
    }
    log.warn(
        "Reserve reconciliation status={} drift_by_asset={} supply_drift={}",
        result.status(),
        result.driftByAsset(),
        result.supplyDrift());
  }
}
