package com.dollarstore.domain.queue;

public enum QueueStatus {
  ACTIVE,
  PARTIALLY_FILLED,
  FILLED,
  CANCELLED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELLED;
  }
}
