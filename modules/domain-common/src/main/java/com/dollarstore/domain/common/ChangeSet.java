package com.dollarstore.domain.common;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Keys a store touched since its current transaction began, in first-touch order. Stores clear it
 * on begin, commit and rollback, so between the mutations and the commit it names exactly the
 * entries that have to be written to durable storage.
 */
public final class ChangeSet<K> {
  private final Set<K> keys = new LinkedHashSet<>();

  public void add(K key) {
    keys.add(Objects.requireNonNull(key, "key must not be null"));
  }

  public Set<K> keys() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(keys));
  }

  public boolean isEmpty() {
    return keys.isEmpty();
  }

  public void clear() {
    keys.clear();
  }
}
