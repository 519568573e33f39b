package com.beobachter.paper.journal;

import com.beobachter.paper.config.PaperTradingProperties;

/**
 * Bounded exponential backoff for journal writes.
 */
public record RetryPolicy(int maxAttempts, long initialBackoffMillis, long maxBackoffMillis) {

  public static RetryPolicy from(PaperTradingProperties.Journal cfg) {
    return new RetryPolicy(
        Math.max(1, cfg.maxAttempts()),
        Math.max(0, cfg.initialBackoffMillis()),
        Math.max(0, cfg.maxBackoffMillis())
    );
  }

  public static RetryPolicy none() {
    return new RetryPolicy(1, 0, 0);
  }

  /**
   * Delay before the given retry, 1-based.
   */
  public long backoffMillis(int retry) {
    long delay = initialBackoffMillis << Math.min(20, Math.max(0, retry - 1));
    return Math.min(maxBackoffMillis, delay);
  }
}
