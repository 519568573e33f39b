package com.beobachter.paper.journal;

import java.util.List;

/**
 * Append-only, totally ordered record of capital and lifecycle events.
 */
public interface Journal {

  /**
   * Assigns the next sequence number and makes the entry durable before returning.
   *
   * @throws JournalWriteException if the entry could not be made durable
   */
  JournalEntry append(JournalEntry entry);

  List<JournalEntry> readAll();

  long lastSequence();
}
