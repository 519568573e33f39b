package com.beobachter.paper.domain;

public enum Side {
  YES,
  NO;

  public Side opposite() {
    return this == YES ? NO : YES;
  }
}
