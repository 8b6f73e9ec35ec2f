package com.dollarstore.exchangeapi.engine;

/**
 * Writes whatever the running operation changed in the in-memory stores to durable storage. Called
 * by {@link ExchangeEngine} inside the operation's database transaction, before the stores commit.
 */
@FunctionalInterface
public interface StateJournal {
  void flush();
}
