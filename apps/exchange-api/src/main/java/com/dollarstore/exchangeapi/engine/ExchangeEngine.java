package com.dollarstore.exchangeapi.engine;

import com.dollarstore.domain.common.ExchangeDomainException;
import com.dollarstore.domain.common.TransactionalStore;
import com.dollarstore.exchangeapi.outbox.OutboxAppendRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Serializes every exchange operation. A write begins a transaction on each store and runs inside
 * one database transaction that also journals the changed state and appends the collected events
 * to the outbox. The stores commit only after the database commit; any throwable rolls every store
 * back and is rethrown.
 */
public class ExchangeEngine {
  private static final Logger log = LoggerFactory.getLogger(ExchangeEngine.class);
  private static final String OPERATIONS_METRIC = "exchange.engine.operations";

  private final ReentrantLock lock = new ReentrantLock(true);
  private final List<TransactionalStore> stores;
  private final StateJournal stateJournal;
  private final OutboxAppendRepository outboxAppendRepository;
  private final TransactionOperations transactionOperations;
  private final MeterRegistry meterRegistry;

  public ExchangeEngine(
      List<TransactionalStore> stores,
      StateJournal stateJournal,
      OutboxAppendRepository outboxAppendRepository,
      TransactionOperations transactionOperations,
      MeterRegistry meterRegistry) {
    this.stores = List.copyOf(stores);
    this.stateJournal = stateJournal;
    this.outboxAppendRepository = outboxAppendRepository;
    this.transactionOperations = transactionOperations;
    this.meterRegistry = meterRegistry;
  }

  public <T> T execute(String operation, Function<EventCollector, T> action) {
    lock.lock();
    try {
      List<TransactionalStore> begun = new ArrayList<>(stores.size());
      try {
        for (TransactionalStore store : stores) {
          store.begin();
          begun.add(store);
        }
        EventCollector events = new EventCollector();
        T result =
            transactionOperations.execute(
                status -> {
                  T value = action.apply(events);
                  stateJournal.flush();
                  events.events().forEach(outboxAppendRepository::append);
                  return value;
                });
        begun.forEach(TransactionalStore::commit);

        outcomeCounter(operation, "committed").increment();
        log.debug(
            "Exchange operation committed operation={} events={}",
            operation,
            events.events().size());
        return result;
      } catch (Throwable ex) {
        rollback(begun);
        outcomeCounter(operation, "rolled_back").increment();
        log.warn(
            "Exchange operation rolled back operation={} code={} error={}",
            operation,
            codeOf(ex),
            ex.getMessage());
        throw ex;
      }
    } finally {
      lock.unlock();
    }
  }

  /** Runs a read under the engine lock so it never observes a half-applied operation. */
  public <T> T read(Supplier<T> query) {
    lock.lock();
    try {
      return query.get();
    } finally {
      lock.unlock();
    }
  }

  private static void rollback(List<TransactionalStore> begun) {
    for (int i = begun.size() - 1; i >= 0; i--) {
      begun.get(i).rollback();
    }
  }

  private static String codeOf(Throwable ex) {
    if (ex instanceof ExchangeDomainException domainException) {
      return domainException.code().name();
    }
    return ex.getClass().getSimpleName();
  }

  private Counter outcomeCounter(String operation, String outcome) {
    return Counter.builder(OPERATIONS_METRIC)
        .description("Exchange engine operations by outcome")
        .tag("operation", operation)
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
