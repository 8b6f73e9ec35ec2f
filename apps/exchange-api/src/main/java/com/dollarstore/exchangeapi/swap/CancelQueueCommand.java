package com.dollarstore.exchangeapi.swap;

public record CancelQueueCommand(String caller, long positionId) {}
