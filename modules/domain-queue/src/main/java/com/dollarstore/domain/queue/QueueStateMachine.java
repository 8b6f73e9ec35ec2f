package com.dollarstore.domain.queue;

import com.dollarstore.domain.common.InvalidTransitionException;
import java.util.EnumSet;
import java.util.Map;

public final class QueueStateMachine {
  private static final Map<QueueStatus, EnumSet<QueueStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          QueueStatus.ACTIVE,
              EnumSet.of(QueueStatus.PARTIALLY_FILLED, QueueStatus.FILLED, QueueStatus.CANCELLED),
          QueueStatus.PARTIALLY_FILLED,
              EnumSet.of(QueueStatus.PARTIALLY_FILLED, QueueStatus.FILLED, QueueStatus.CANCELLED),
          QueueStatus.FILLED, EnumSet.noneOf(QueueStatus.class),
          QueueStatus.CANCELLED, EnumSet.noneOf(QueueStatus.class));

  private QueueStateMachine() {}

  public static boolean canTransition(QueueStatus from, QueueStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<QueueStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(QueueStatus from, QueueStatus to) {
    if (!canTransition(from, to)) {
      throw new InvalidTransitionException(
          "Invalid queue position transition from " + from + " to " + to);
    }
  }
}
