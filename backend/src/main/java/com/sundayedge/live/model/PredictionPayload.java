package com.sundayedge.live.model;

public class PredictionPayload {
  private String pick;
  private Double line;
  private int confidence;
  private String context;
  private String player;
  private String stat;

  public PredictionPayload() {}

  public PredictionPayload(String pick, Double line, int confidence, String context) {
    this.pick = pick;
    this.line = line;
    this.confidence = confidence;
    this.context = context;
  }

  public static PredictionPayload pick(String pick, int confidence) {
    return new PredictionPayload(pick, null, confidence, "");
  }

  public static PredictionPayload pickWithLine(String pick, double line, int confidence) {
    return new PredictionPayload(pick, line, confidence, "");
  }

  public String getPick() {
    return pick;
  }

  public void setPick(String pick) {
    this.pick = pick;
  }

  public Double getLine() {
    return line;
  }

  public void setLine(Double line) {
    this.line = line;
  }

  public int getConfidence() {
    return confidence;
  }

  public void setConfidence(int confidence) {
    this.confidence = confidence;
  }

  public String getContext() {
    return context;
  }

  public void setContext(String context) {
    this.context = context;
  }

  public String getPlayer() {
    return player;
  }

  public void setPlayer(String player) {
    this.player = player;
  }

  public String getStat() {
    return stat;
  }

  public void setStat(String stat) {
    this.stat = stat;
  }
}
