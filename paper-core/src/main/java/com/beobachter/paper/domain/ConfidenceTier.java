package com.beobachter.paper.domain;

public enum ConfidenceTier {
  LOW,
  MEDIUM,
  HIGH
}
