package com.sundayedge.live.service;

public class GameFinalizedEvent {
  private final String gameId;

  public GameFinalizedEvent(String gameId) {
    this.gameId = gameId;
  }

  public String getGameId() {
    return gameId;
  }
}
