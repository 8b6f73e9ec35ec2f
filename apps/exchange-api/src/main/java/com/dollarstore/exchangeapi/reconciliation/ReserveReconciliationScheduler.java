package com.dollarstore.exchangeapi.reconciliation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "reconciliation.reserve",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class ReserveReconciliationScheduler {
  private final ReserveReconciliationService reconciliationService;

  public ReserveReconciliationScheduler(ReserveReconciliationService reconciliationService) {
    this.reconciliationService = reconciliationService;
  }

  @Scheduled(fixedDelayString = "${reconciliation.reserve.fixed-delay-ms:60000}")
  public void runScheduled() {
    reconciliationService.runOnce();
  }
}
