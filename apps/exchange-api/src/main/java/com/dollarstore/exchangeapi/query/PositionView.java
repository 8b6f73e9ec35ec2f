package com.dollarstore.exchangeapi.query;

import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.domain.queue.QueuePositionInfo;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/** Queue placement fields are null once the position is filled or cancelled. */
public record PositionView(
    long id,
    String owner,
    String asset,
    BigInteger originalAmount,
    BigInteger remainingAmount,
    BigInteger filledAmount,
    String status,
    Instant createdAt,
    Instant updatedAt,
    Integer positionNumber,
    BigInteger amountAhead,
    BigDecimal fillScore) {

  static PositionView of(QueuePosition position, QueuePositionInfo info, BigDecimal fillScore) {
    return new PositionView(
        position.id(),
        position.owner(),
        position.asset(),
        position.originalAmount(),
        position.remainingAmount(),
        position.filledAmount(),
        position.status().name(),
        position.createdAt(),
        position.updatedAt(),
        info == null ? null : info.positionNumber(),
        info == null ? null : info.amountAhead(),
        fillScore);
  }
}
