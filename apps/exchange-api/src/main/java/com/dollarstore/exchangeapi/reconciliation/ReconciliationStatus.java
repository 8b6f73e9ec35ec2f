package com.dollarstore.exchangeapi.reconciliation;

public enum ReconciliationStatus {
  MATCHED,
  DRIFT_DETECTED
}
