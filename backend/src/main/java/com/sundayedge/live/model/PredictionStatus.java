package com.sundayedge.live.model;

public enum PredictionStatus {
  PENDING,
  WIN,
  LOSS,
  PUSH;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
