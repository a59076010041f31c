package com.sundayedge.live.model;

/** One game snapshot as reported by the scoreboard feed. Null fields were absent in the feed. */
public final class ExternalGameEvent {
  private final String homeTeamLabel;
  private final String awayTeamLabel;
  private final Integer homeScore;
  private final Integer awayScore;
  private final String statusText;
  private final Integer period;
  private final Boolean overtime;
  private final String clock;

  public ExternalGameEvent(
      String homeTeamLabel,
      String awayTeamLabel,
      Integer homeScore,
      Integer awayScore,
      String statusText,
      Integer period,
      Boolean overtime,
      String clock) {
    this.homeTeamLabel = homeTeamLabel;
    this.awayTeamLabel = awayTeamLabel;
    this.homeScore = homeScore;
    this.awayScore = awayScore;
    this.statusText = statusText;
    this.period = period;
    this.overtime = overtime;
    this.clock = clock;
  }

  public static ExternalGameEvent of(
      String homeTeamLabel,
      String awayTeamLabel,
      Integer homeScore,
      Integer awayScore,
      String statusText) {
    return new ExternalGameEvent(
        homeTeamLabel, awayTeamLabel, homeScore, awayScore, statusText, null, null, null);
  }

  public String getHomeTeamLabel() {
    return homeTeamLabel;
  }

  public String getAwayTeamLabel() {
    return awayTeamLabel;
  }

  public Integer getHomeScore() {
    return homeScore;
  }

  public Integer getAwayScore() {
    return awayScore;
  }

  public String getStatusText() {
    return statusText;
  }

  public Integer getPeriod() {
    return period;
  }

  public Boolean getOvertime() {
    return overtime;
  }

  public String getClock() {
    return clock;
  }

  @Override
  public String toString() {
    return awayTeamLabel
        + " @ "
        + homeTeamLabel
        + " "
        + (awayScore == null ? "?" : awayScore)
        + "-"
        + (homeScore == null ? "?" : homeScore)
        + " ("
        + statusText
        + ")";
  }
}
