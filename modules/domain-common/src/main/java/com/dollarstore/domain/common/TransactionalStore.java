package com.dollarstore.domain.common;

/**
 * A mutable store that can take part in an exchange transaction. Mutations made between {@link
 * #begin()} and {@link #commit()} are reverted by {@link #rollback()}.
 */
public interface TransactionalStore {
  void begin();

  void commit();

  void rollback();
}
