package com.sundayedge.live.model;

public class ScheduledGame {
  private String id;
  private String homeTeam;
  private String awayTeam;
  private String kickoffTime;
  private String venue;
  private String broadcast;
  private Integer baselineHomeWinProbability;

  public ScheduledGame() {}

  public ScheduledGame(String id, String homeTeam, String awayTeam, String kickoffTime) {
    this.id = id;
    this.homeTeam = homeTeam;
    this.awayTeam = awayTeam;
    this.kickoffTime = kickoffTime;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
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

  public Integer getBaselineHomeWinProbability() {
    return baselineHomeWinProbability;
  }

  public void setBaselineHomeWinProbability(Integer baselineHomeWinProbability) {
    this.baselineHomeWinProbability = baselineHomeWinProbability;
  }
}
