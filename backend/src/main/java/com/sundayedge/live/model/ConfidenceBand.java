package com.sundayedge.live.model;

public enum ConfidenceBand {
  LOW(0),
  MEDIUM(55),
  HIGH(70),
  VERY_HIGH(85);

  private final int lowerBound;

  ConfidenceBand(int lowerBound) {
    this.lowerBound = lowerBound;
  }

  public int getLowerBound() {
    return lowerBound;
  }

  public static ConfidenceBand forConfidence(int confidence) {
    ConfidenceBand result = LOW;
    for (ConfidenceBand band : values()) {
      if (confidence >= band.lowerBound) {
        result = band;
      }
    }
    return result;
  }
}
