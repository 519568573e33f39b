package com.beobachter.paper.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per market id. Always taken before the ledger lock.
 */
public class MarketLocks {

  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(String marketId, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(marketId, id -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
