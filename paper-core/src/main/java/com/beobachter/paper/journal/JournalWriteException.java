package com.beobachter.paper.journal;

public class JournalWriteException extends RuntimeException {

  public JournalWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
