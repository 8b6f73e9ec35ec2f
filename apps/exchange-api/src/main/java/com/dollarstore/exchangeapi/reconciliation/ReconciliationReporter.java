package com.dollarstore.exchangeapi.reconciliation;

public interface ReconciliationReporter {
  void report(ReconciliationResult result);
}
