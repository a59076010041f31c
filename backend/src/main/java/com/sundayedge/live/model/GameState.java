package com.sundayedge.live.model;

public enum GameState {
  SCHEDULED,
  LIVE,
  FINAL;

  public boolean isBefore(GameState other) {
    return ordinal() < other.ordinal();
  }
}
