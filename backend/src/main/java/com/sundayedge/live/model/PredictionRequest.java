package com.sundayedge.live.model;

public class PredictionRequest {
  private String gameId;
  private PredictionKind kind;
  private PredictionPayload payload;

  public PredictionRequest() {}

  public String getGameId() {
    return gameId;
  }

  public void setGameId(String gameId) {
    this.gameId = gameId;
  }

  public PredictionKind getKind() {
    return kind;
  }

  public void setKind(PredictionKind kind) {
    this.kind = kind;
  }

  public PredictionPayload getPayload() {
    return payload;
  }

  public void setPayload(PredictionPayload payload) {
    this.payload = payload;
  }
}
