package com.flamingo.ai.dealflow.service.clustering;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Striped;
import java.util.Collection;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Single-writer discipline per clustering key. Locks are striped, so unrelated keys may share a
 * stripe; bulk acquisition takes stripes in a fixed order and the locks are reentrant.
 */
@Component
public class DealKeyLocks {

  private final Striped<Lock> stripes;

  public DealKeyLocks(DealflowConfig config) {
    this.stripes = Striped.lock(config.getClustering().getLockStripes());
  }

  /** Runs {@code work} while holding the locks of every key in {@code keys}. */
  public <T> T withLocks(Collection<String> keys, Supplier<T> work) {
    ImmutableList<Lock> locks = ImmutableList.copyOf(stripes.bulkGet(keys));
    for (Lock lock : locks) {
      lock.lock();
    }
    try {
      return work.get();
    } finally {
      for (Lock lock : locks.reverse()) {
        lock.unlock();
      }
    }
  }
}
