package com.dollarstore.exchangeapi.outbox;

import com.dollarstore.exchangeapi.engine.ExchangeEvent;

public interface OutboxAppendRepository {
  void append(ExchangeEvent event);
}
