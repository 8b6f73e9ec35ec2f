package com.dollarstore.domain.queue;

import com.dollarstore.domain.common.Amounts;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

public record QueuePosition(
    long id,
    String owner,
    String asset,
    BigInteger originalAmount,
    BigInteger remainingAmount,
    QueueStatus status,
    Instant createdAt,
    Instant updatedAt) {
  public QueuePosition {
    if (id < 1) {
      throw new IllegalArgumentException("id must be >= 1");
    }
    Amounts.requireNonBlank(owner, "owner");
    Amounts.requireNonBlank(asset, "asset");
    Amounts.requirePositive(originalAmount, "originalAmount");
    Amounts.requireNonNegative(remainingAmount, "remainingAmount");
    if (remainingAmount.compareTo(originalAmount) > 0) {
      throw new IllegalArgumentException("remainingAmount must not exceed originalAmount");
    }
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public static QueuePosition createNew(
      long id, String owner, String asset, BigInteger amount, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new QueuePosition(id, owner, asset, amount, amount, QueueStatus.ACTIVE, now, now);
  }

  public QueuePosition fill(BigInteger amount, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    Amounts.requirePositive(amount, "fill amount");
    if (amount.compareTo(remainingAmount) > 0) {
      throw new IllegalArgumentException(
          "fill amount " + amount + " exceeds remaining " + remainingAmount + " of position " + id);
    }
    BigInteger nextRemaining = remainingAmount.subtract(amount);
    QueueStatus nextStatus =
        nextRemaining.signum() == 0 ? QueueStatus.FILLED : QueueStatus.PARTIALLY_FILLED;
    QueueStateMachine.validateTransition(status, nextStatus);
    return new QueuePosition(
        id, owner, asset, originalAmount, nextRemaining, nextStatus, createdAt, now);
  }

  public QueuePosition cancel(Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    QueueStateMachine.validateTransition(status, QueueStatus.CANCELLED);
    return new QueuePosition(
        id, owner, asset, originalAmount, remainingAmount, QueueStatus.CANCELLED, createdAt, now);
  }

  public BigInteger filledAmount() {
    return originalAmount.subtract(remainingAmount);
  }

  public boolean isOpen() {
    return !status.isTerminal();
  }
}
