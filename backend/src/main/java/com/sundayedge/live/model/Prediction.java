package com.sundayedge.live.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class Prediction {
  private String id;
  private String gameId;
  private PredictionKind kind;
  private String homeTeam;
  private String awayTeam;
  private String pick;
  private Double line;
  private int confidence;
  private String context;
  private String player;
  private String stat;
  private PredictionStatus status = PredictionStatus.PENDING;
  private boolean needsReview;
  private String reviewReason;
  private Integer finalHomeScore;
  private Integer finalAwayScore;
  private String createdAt;
  private String gradedAt;
  private long gradedSequence;

  public Prediction() {}

  public static String idFor(String gameId, PredictionKind kind) {
    return gameId + ":" + kind.name();
  }

  public Prediction copy() {
    Prediction copy = new Prediction();
    copy.id = id;
    copy.gameId = gameId;
    copy.kind = kind;
    copy.homeTeam = homeTeam;
    copy.awayTeam = awayTeam;
    copy.pick = pick;
    copy.line = line;
    copy.confidence = confidence;
    copy.context = context;
    copy.player = player;
    copy.stat = stat;
    copy.status = status;
    copy.needsReview = needsReview;
    copy.reviewReason = reviewReason;
    copy.finalHomeScore = finalHomeScore;
    copy.finalAwayScore = finalAwayScore;
    copy.createdAt = createdAt;
    copy.gradedAt = gradedAt;
    copy.gradedSequence = gradedSequence;
    return copy;
  }

  @JsonIgnore
  public ConfidenceBand getConfidenceBand() {
    return ConfidenceBand.forConfidence(confidence);
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

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

  public String getHomeTeam() {
    return homeTeam;
  }

  public void setHomeTeam(String homeTeam) {
    this.homeTeam = homeTeam;
  }

  public String getAwayTeam() {
    return awayTeam;
  }

  public void setAwayTeam(String awayTeam) {
    this.awayTeam = awayTeam;
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

  public PredictionStatus getStatus() {
    return status;
  }

  public void setStatus(PredictionStatus status) {
    this.status = status;
  }

  public boolean isNeedsReview() {
    return needsReview;
  }

  public void setNeedsReview(boolean needsReview) {
    this.needsReview = needsReview;
  }

  public String getReviewReason() {
    return reviewReason;
  }

  public void setReviewReason(String reviewReason) {
    this.reviewReason = reviewReason;
  }

  public Integer getFinalHomeScore() {
    return finalHomeScore;
  }

  public void setFinalHomeScore(Integer finalHomeScore) {
    this.finalHomeScore = finalHomeScore;
  }

  public Integer getFinalAwayScore() {
    return finalAwayScore;
  }

  public void setFinalAwayScore(Integer finalAwayScore) {
    this.finalAwayScore = finalAwayScore;
  }

  public String getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(String createdAt) {
    this.createdAt = createdAt;
  }

  public String getGradedAt() {
    return gradedAt;
  }

  public void setGradedAt(String gradedAt) {
    this.gradedAt = gradedAt;
  }

  public long getGradedSequence() {
    return gradedSequence;
  }

  public void setGradedSequence(long gradedSequence) {
    this.gradedSequence = gradedSequence;
  }
}
