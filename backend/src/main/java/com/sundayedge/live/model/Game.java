package com.sundayedge.live.model;

public class Game {
  private String id;
  private String windowId;
  private String homeTeam;
  private String awayTeam;
  private String kickoffTime;
  private String venue;
  private String broadcast;
  private int baselineHomeWinProbability;
  private int homeScore;
  private int awayScore;
  private Integer period;
  private boolean overtime;
  private String clock;
  private GameState state = GameState.SCHEDULED;
  private int homeWinProbability;
  private int awayWinProbability;
  private String confidenceLabel;
  private String lastUpdated;
  private String finalizedAt;

  public Game() {}

  public Game(
      String id,
      String windowId,
      String homeTeam,
      String awayTeam,
      String kickoffTime,
      String venue,
      String broadcast,
      int baselineHomeWinProbability) {
    this.id = id;
    this.windowId = windowId;
    this.homeTeam = homeTeam;
    this.awayTeam = awayTeam;
    this.kickoffTime = kickoffTime;
    this.venue = venue;
    this.broadcast = broadcast;
    this.baselineHomeWinProbability = baselineHomeWinProbability;
    this.homeWinProbability = baselineHomeWinProbability;
    this.awayWinProbability = 100 - baselineHomeWinProbability;
  }

  public Game copy() {
    Game copy =
        new Game(
            id, windowId, homeTeam, awayTeam, kickoffTime, venue, broadcast,
            baselineHomeWinProbability);
    copy.homeScore = homeScore;
    copy.awayScore = awayScore;
    copy.period = period;
    copy.overtime = overtime;
    copy.clock = clock;
    copy.state = state;
    copy.homeWinProbability = homeWinProbability;
    copy.awayWinProbability = awayWinProbability;
    copy.confidenceLabel = confidenceLabel;
    copy.lastUpdated = lastUpdated;
    copy.finalizedAt = finalizedAt;
    return copy;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getWindowId() {
    return windowId;
  }

  public void setWindowId(String windowId) {
    this.windowId = windowId;
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

  public String getKickoffTime() {
    return kickoffTime;
  }

  public void setKickoffTime(String kickoffTime) {
    this.kickoffTime = kickoffTime;
  }

  public String getVenue() {
    return venue;
  }

  public void setVenue(String venue) {
    this.venue = venue;
  }

  public String getBroadcast() {
    return broadcast;
  }

  public void setBroadcast(String broadcast) {
    this.broadcast = broadcast;
  }

  public int getBaselineHomeWinProbability() {
    return baselineHomeWinProbability;
  }

  public void setBaselineHomeWinProbability(int baselineHomeWinProbability) {
    this.baselineHomeWinProbability = baselineHomeWinProbability;
  }

  public int getHomeScore() {
    return homeScore;
  }

  public void setHomeScore(int homeScore) {
    this.homeScore = homeScore;
  }

  public int getAwayScore() {
    return awayScore;
  }

  public void setAwayScore(int awayScore) {
    this.awayScore = awayScore;
  }

  public Integer getPeriod() {
    return period;
  }

  public void setPeriod(Integer period) {
    this.period = period;
  }

  public boolean isOvertime() {
    return overtime;
  }

  public void setOvertime(boolean overtime) {
    this.overtime = overtime;
  }

  public String getClock() {
    return clock;
  }

  public void setClock(String clock) {
    this.clock = clock;
  }

  public GameState getState() {
    return state;
  }

  public void setState(GameState state) {
    this.state = state;
  }

  public int getHomeWinProbability() {
    return homeWinProbability;
  }

  public void setHomeWinProbability(int homeWinProbability) {
    this.homeWinProbability = homeWinProbability;
  }

  public int getAwayWinProbability() {
    return awayWinProbability;
  }

  public void setAwayWinProbability(int awayWinProbability) {
    this.awayWinProbability = awayWinProbability;
  }

  public String getConfidenceLabel() {
    return confidenceLabel;
  }

  public void setConfidenceLabel(String confidenceLabel) {
    this.confidenceLabel = confidenceLabel;
  }

  public String getLastUpdated() {
    return lastUpdated;
  }

  public void setLastUpdated(String lastUpdated) {
    this.lastUpdated = lastUpdated;
  }

  public String getFinalizedAt() {
    return finalizedAt;
  }

  public void setFinalizedAt(String finalizedAt) {
    this.finalizedAt = finalizedAt;
  }
}
