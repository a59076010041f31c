package com.sundayedge.live.model;

public final class UpsertResult {
  public enum Outcome {
    APPLIED,
    SCORE_REJECTED,
    IGNORED_FINAL,
    UNKNOWN_GAME
  }

  private final String gameId;
  private final Outcome outcome;
  private final GameState previousState;
  private final GameState newState;
  private final boolean finalized;
  private final String reason;

  private UpsertResult(
      String gameId,
      Outcome outcome,
      GameState previousState,
      GameState newState,
      boolean finalized,
      String reason) {
    this.gameId = gameId;
    this.outcome = outcome;
    this.previousState = previousState;
    this.newState = newState;
    this.finalized = finalized;
    this.reason = reason;
  }

  public static UpsertResult applied(
      String gameId, GameState previousState, GameState newState, boolean finalized) {
    return new UpsertResult(gameId, Outcome.APPLIED, previousState, newState, finalized, "");
  }

  public static UpsertResult scoreRejected(String gameId, GameState state, String reason) {
    return new UpsertResult(gameId, Outcome.SCORE_REJECTED, state, state, false, reason);
  }

  public static UpsertResult ignoredFinal(String gameId) {
    return new UpsertResult(
        gameId, Outcome.IGNORED_FINAL, GameState.FINAL, GameState.FINAL, false, "Game is final");
  }

  public static UpsertResult unknownGame(String gameId) {
    return new UpsertResult(gameId, Outcome.UNKNOWN_GAME, null, null, false, "Unknown game");
  }

  public String getGameId() {
    return gameId;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public GameState getPreviousState() {
    return previousState;
  }

  public GameState getNewState() {
    return newState;
  }

  public boolean isFinalized() {
    return finalized;
  }

  public boolean isRejected() {
    return outcome == Outcome.SCORE_REJECTED || outcome == Outcome.UNKNOWN_GAME;
  }

  public String getReason() {
    return reason;
  }
}
