package com.dollarstore.exchangeapi.engine;

import java.util.ArrayList;
import java.util.List;

public final class EventCollector {
  private final List<ExchangeEvent> events = new ArrayList<>();

  public void add(ExchangeEvent event) {
    events.add(event);
  }

  public List<ExchangeEvent> events() {
    return List.copyOf(events);
  }
}
