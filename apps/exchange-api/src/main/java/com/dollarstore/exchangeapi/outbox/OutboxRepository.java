package com.dollarstore.exchangeapi.outbox;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface OutboxRepository {
  /** Claims up to {@code limit} due events, oldest first, marking them PROCESSING. */
  List<OutboxEventRecord> claimBatch(int limit);

  void markPublished(UUID id, Instant publishedAt);

  void markFailed(UUID id, String errorMessage);
}
